package com.dexarena.tournament.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A qualification match between two participants, or a bye when the second is absent.
 * The result is write-once; recording it updates both participants' counters.
 */
public final class Match {

    private final Participant participant1;
    private final Participant participant2;
    private final int round;
    private MatchResult result;

    private Match(Participant participant1, Participant participant2, int round) {
        this.participant1 = Objects.requireNonNull(participant1, "participant1");
        this.participant2 = participant2;
        if (participant2 != null && participant1.equals(participant2)) {
            throw new InvalidTournamentInputException("Participants cannot be the same: " + participant1.id());
        }
        if (round < 0) {
            throw new InvalidTournamentInputException("Round number cannot be negative");
        }
        this.round = round;
    }

    public static Match between(Participant participant1, Participant participant2, int round) {
        return new Match(participant1, Objects.requireNonNull(participant2, "participant2"), round);
    }

    public static Match bye(Participant participant, int round) {
        return new Match(participant, null, round);
    }

    public Participant participant1() {
        return participant1;
    }

    public Optional<Participant> participant2() {
        return Optional.ofNullable(participant2);
    }

    public int round() {
        return round;
    }

    public boolean isBye() {
        return participant2 == null;
    }

    public Optional<MatchResult> result() {
        return Optional.ofNullable(result);
    }

    public boolean isComplete() {
        return result != null;
    }

    public void recordResult(MatchResult result) {
        Objects.requireNonNull(result, "result");
        if (isComplete()) {
            throw new TournamentStateException("Cannot record result for completed match: " + this);
        }
        validateWinner(result);
        this.result = result;

        if (isBye()) {
            participant1.addWin();
        } else if (result.isDraw()) {
            participant1.addDraw();
            participant2.addDraw();
        } else if (result.winner().get().equals(participant1.id())) {
            participant1.addWin();
            participant2.addLoss();
        } else {
            participant1.addLoss();
            participant2.addWin();
        }
    }

    /**
     * Converts a completed match into its persisted form.
     */
    public MatchRecord toRecord() {
        if (!isComplete()) {
            throw new TournamentStateException("Cannot persist incomplete match: " + this);
        }
        return new MatchRecord(
            round,
            participant1.id(),
            participant2().map(Participant::id),
            result.outcome(),
            result.winner());
    }

    private void validateWinner(MatchResult result) {
        if (isBye()) {
            if (result.outcome() != Outcome.WIN || !result.winner().get().equals(participant1.id())) {
                throw new InvalidTournamentInputException("A bye can only be recorded as a win for " + participant1.id());
            }
            return;
        }
        if (result.isDraw()) {
            return;
        }
        CompetitorId winner = result.winner().get();
        if (!winner.equals(participant1.id()) && !winner.equals(participant2.id())) {
            throw new InvalidTournamentInputException("Winner must be one of the match participants: " + winner);
        }
    }

    @Override
    public String toString() {
        String opponent = isBye() ? "(bye)" : participant2.id().toString();
        return String.format("Round %d: %s vs %s (%s)", round, participant1.id(), opponent,
            isComplete() ? "Complete" : "Incomplete");
    }
}
