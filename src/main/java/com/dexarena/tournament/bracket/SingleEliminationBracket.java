package com.dexarena.tournament.bracket;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.TournamentStateException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable single-elimination bracket. Round 1 pairs seed {@code i} with seed
 * {@code n-1-i}; with eight entrants the matches are ordered 1v8, 4v5, 3v6, 2v7 so the
 * top two seeds can only meet in the final. Later rounds pair the winners of adjacent
 * matches and are created as soon as the previous round is fully decided.
 */
public record SingleEliminationBracket(
    @JsonProperty("rounds") ImmutableList<ImmutableList<BracketMatch>> rounds
) implements PlayoffBracket {

    private static final int[] EIGHT_ENTRANT_ORDER = {0, 3, 2, 1};

    public SingleEliminationBracket {
        Objects.requireNonNull(rounds, "rounds");
        if (rounds.isEmpty() || rounds.get(0).isEmpty()) {
            throw new InvalidTournamentInputException("Bracket must have a first round");
        }
    }

    public static SingleEliminationBracket create(List<CompetitorId> seeded) {
        if (seeded == null || seeded.size() < 2) {
            throw new InvalidTournamentInputException("Bracket requires at least 2 participants");
        }
        if (!IntMath.isPowerOfTwo(seeded.size())) {
            throw new InvalidTournamentInputException(
                "Single elimination requires a power-of-two participant count, got " + seeded.size());
        }
        int n = seeded.size();
        List<CompetitorId[]> pairs = new ArrayList<>();
        for (int left = 0, right = n - 1; left < right; left++, right--) {
            pairs.add(new CompetitorId[] {seeded.get(left), seeded.get(right)});
        }
        if (n == 8) {
            List<CompetitorId[]> remapped = new ArrayList<>();
            for (int index : EIGHT_ENTRANT_ORDER) {
                remapped.add(pairs.get(index));
            }
            pairs = remapped;
        }

        ImmutableList.Builder<BracketMatch> first = ImmutableList.builder();
        for (int i = 0; i < pairs.size(); i++) {
            CompetitorId[] pair = pairs.get(i);
            first.add(BracketMatch.of(BracketSide.SINGLE.matchId(1, i + 1), BracketSide.SINGLE, 1, pair[0], pair[1]));
        }
        return new SingleEliminationBracket(ImmutableList.of(first.build()));
    }

    @JsonIgnore
    public List<BracketMatch> currentRoundMatches() {
        return rounds.get(rounds.size() - 1);
    }

    @JsonIgnore
    public int currentRound() {
        return rounds.size();
    }

    @Override
    public Optional<BracketMatch> nextMatch() {
        return currentRoundMatches().stream().filter(BracketMatch::isReady).findFirst();
    }

    /**
     * Records a winner in the current round. When that completes the round, the next
     * round is generated from the winners.
     */
    @Override
    public SingleEliminationBracket recordResult(String matchId, CompetitorId winner) {
        if (isComplete()) {
            throw new TournamentStateException("Bracket is already complete");
        }
        List<BracketMatch> current = currentRoundMatches();
        List<BracketMatch> updated = new ArrayList<>(current.size());
        boolean found = false;
        for (BracketMatch match : current) {
            if (match.id().equals(matchId)) {
                updated.add(match.withWinner(winner));
                found = true;
            } else {
                updated.add(match);
            }
        }
        if (!found) {
            throw new InvalidTournamentInputException("Unknown match in current round: " + matchId);
        }

        ImmutableList.Builder<ImmutableList<BracketMatch>> builder = ImmutableList.builder();
        builder.addAll(rounds.subList(0, rounds.size() - 1));
        builder.add(ImmutableList.copyOf(updated));
        if (updated.size() > 1 && updated.stream().allMatch(BracketMatch::isDecided)) {
            builder.add(pairAdjacent(updated, rounds.size() + 1));
        }
        return new SingleEliminationBracket(builder.build());
    }

    private static ImmutableList<BracketMatch> pairAdjacent(List<BracketMatch> decided, int round) {
        ImmutableList.Builder<BracketMatch> next = ImmutableList.builder();
        for (int i = 0; i < decided.size(); i += 2) {
            next.add(BracketMatch.of(
                BracketSide.SINGLE.matchId(round, i / 2 + 1), BracketSide.SINGLE, round,
                decided.get(i).winner().orElseThrow(), decided.get(i + 1).winner().orElseThrow()));
        }
        return next.build();
    }

    @Override
    @JsonIgnore
    public boolean isComplete() {
        List<BracketMatch> last = currentRoundMatches();
        return last.size() == 1 && last.get(0).isDecided();
    }

    @Override
    public Optional<CompetitorId> champion() {
        return isComplete() ? currentRoundMatches().get(0).winner() : Optional.empty();
    }
}
