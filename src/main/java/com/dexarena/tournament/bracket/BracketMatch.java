package com.dexarena.tournament.bracket;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.TournamentStateException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single elimination match. Slots fill as competitors arrive; the match is
 * ready once both slots are filled and no winner is set.
 */
public record BracketMatch(
    @JsonProperty("id") String id,
    @JsonProperty("side") BracketSide side,
    @JsonProperty("round") int round,
    @JsonProperty("participant1") Optional<CompetitorId> participant1,
    @JsonProperty("participant2") Optional<CompetitorId> participant2,
    @JsonProperty("winner") Optional<CompetitorId> winner
) {

    public BracketMatch {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(side, "side");
        participant1 = participant1 == null ? Optional.empty() : participant1;
        participant2 = participant2 == null ? Optional.empty() : participant2;
        winner = winner == null ? Optional.empty() : winner;
    }

    public static BracketMatch empty(String id, BracketSide side, int round) {
        return new BracketMatch(id, side, round, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static BracketMatch of(String id, BracketSide side, int round, CompetitorId first, CompetitorId second) {
        return new BracketMatch(id, side, round, Optional.ofNullable(first), Optional.ofNullable(second), Optional.empty());
    }

    @JsonIgnore
    public boolean isReady() {
        return participant1.isPresent() && participant2.isPresent() && winner.isEmpty();
    }

    @JsonIgnore
    public boolean isDecided() {
        return winner.isPresent();
    }

    @JsonIgnore
    public boolean hasOpenSlot() {
        return participant1.isEmpty() || participant2.isEmpty();
    }

    @JsonIgnore
    public List<CompetitorId> entrants() {
        List<CompetitorId> entrants = new ArrayList<>(2);
        participant1.ifPresent(entrants::add);
        participant2.ifPresent(entrants::add);
        return entrants;
    }

    public boolean involves(CompetitorId competitor) {
        return participant1.map(competitor::equals).orElse(false)
            || participant2.map(competitor::equals).orElse(false);
    }

    /**
     * Places a competitor into the first open slot.
     */
    public BracketMatch withEntrant(CompetitorId competitor) {
        if (participant1.isEmpty()) {
            return new BracketMatch(id, side, round, Optional.of(competitor), participant2, winner);
        }
        if (participant2.isEmpty()) {
            return new BracketMatch(id, side, round, participant1, Optional.of(competitor), winner);
        }
        throw new TournamentStateException("Match " + id + " has no open slot for " + competitor);
    }

    public BracketMatch withParticipant1(CompetitorId competitor) {
        if (participant1.isPresent()) {
            throw new TournamentStateException("Match " + id + " slot 1 is already taken by " + participant1.get());
        }
        return new BracketMatch(id, side, round, Optional.of(competitor), participant2, winner);
    }

    public BracketMatch withParticipant2(CompetitorId competitor) {
        if (participant2.isPresent()) {
            throw new TournamentStateException("Match " + id + " slot 2 is already taken by " + participant2.get());
        }
        return new BracketMatch(id, side, round, participant1, Optional.of(competitor), winner);
    }

    /**
     * Records the winner. Write-once; the winner must occupy one of the slots.
     */
    public BracketMatch withWinner(CompetitorId competitor) {
        if (isDecided()) {
            throw new TournamentStateException("Match " + id + " is already decided: " + winner.get());
        }
        if (!involves(competitor)) {
            throw new InvalidTournamentInputException(
                "Winner must be one of the match participants: " + competitor + " not in " + id);
        }
        return new BracketMatch(id, side, round, participant1, participant2, Optional.of(competitor));
    }

    /**
     * The participant that did not win, if the match had two.
     */
    public Optional<CompetitorId> loserFor(CompetitorId matchWinner) {
        return entrants().stream().filter(c -> !c.equals(matchWinner)).findFirst();
    }
}
