package com.dexarena.tournament.bracket;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a 16-entrant double-elimination bracket.
 *
 * <p>Matches are keyed by id. The round lists hold ids in creation order so the
 * scan order of a round is stable across persistence. The grand final always
 * exists; its slots stay empty until the two ladders produce their champions.
 * With {@code resetEnabled}, a loser-ladder champion who wins the grand final
 * forces a reset match that decides the bracket.
 */
public record DoubleEliminationBracket(
    @JsonProperty("matches") ImmutableMap<String, BracketMatch> matches,
    @JsonProperty("winnerRounds") ImmutableList<ImmutableList<String>> winnerRounds,
    @JsonProperty("loserRounds") ImmutableList<ImmutableList<String>> loserRounds,
    @JsonProperty("grandFinalId") String grandFinalId,
    @JsonProperty("resetEnabled") boolean resetEnabled
) implements PlayoffBracket {

    public DoubleEliminationBracket {
        Objects.requireNonNull(matches, "matches");
        Objects.requireNonNull(winnerRounds, "winnerRounds");
        Objects.requireNonNull(loserRounds, "loserRounds");
        Objects.requireNonNull(grandFinalId, "grandFinalId");
        if (!matches.containsKey(grandFinalId)) {
            throw new InvalidTournamentInputException("Bracket has no grand final match " + grandFinalId);
        }
        for (List<String> round : winnerRounds) {
            requireKnown(matches, round);
        }
        for (List<String> round : loserRounds) {
            requireKnown(matches, round);
        }
    }

    private static void requireKnown(Map<String, BracketMatch> matches, List<String> ids) {
        for (String id : ids) {
            if (!matches.containsKey(id)) {
                throw new InvalidTournamentInputException("Bracket round references unknown match " + id);
            }
        }
    }

    public Optional<BracketMatch> match(String id) {
        return Optional.ofNullable(matches.get(id));
    }

    @JsonIgnore
    public BracketMatch grandFinal() {
        return matches.get(grandFinalId);
    }

    /**
     * The reset match, present only once the loser-ladder champion has won the grand final.
     */
    @JsonIgnore
    public Optional<BracketMatch> resetMatch() {
        return match(DoubleEliminationBracketEngine.RESET_ID);
    }

    /**
     * Matches of one round of a ladder, in creation order. Rounds are 1-based.
     */
    public List<BracketMatch> round(BracketSide side, int round) {
        List<ImmutableList<String>> rounds = switch (side) {
            case WINNER -> winnerRounds;
            case LOSER -> loserRounds;
            default -> throw new IllegalArgumentException("No numbered rounds on side " + side);
        };
        if (round < 1 || round > rounds.size()) {
            throw new IllegalArgumentException("Round " + round + " out of range for " + side);
        }
        return rounds.get(round - 1).stream().map(matches::get).toList();
    }

    /**
     * Every match in scan order: winner rounds, then loser rounds, then the grand final
     * and its reset.
     */
    @JsonIgnore
    public List<BracketMatch> allMatches() {
        List<BracketMatch> all = new ArrayList<>(matches.size());
        winnerRounds.forEach(round -> round.forEach(id -> all.add(matches.get(id))));
        loserRounds.forEach(round -> round.forEach(id -> all.add(matches.get(id))));
        all.add(grandFinal());
        resetMatch().ifPresent(all::add);
        return all;
    }

    /**
     * Returns a copy with the given match replaced.
     */
    DoubleEliminationBracket withMatch(BracketMatch match) {
        if (!matches.containsKey(match.id())) {
            throw new IllegalArgumentException("Unknown match " + match.id());
        }
        Map<String, BracketMatch> updated = new LinkedHashMap<>(matches);
        updated.put(match.id(), match);
        return new DoubleEliminationBracket(
            ImmutableMap.copyOf(updated), winnerRounds, loserRounds, grandFinalId, resetEnabled);
    }

    /**
     * Returns a copy with a new match appended to the end of its round. Grand-final
     * side matches have no round list and are only added to the match map.
     */
    DoubleEliminationBracket withAppendedMatch(BracketMatch match) {
        if (matches.containsKey(match.id())) {
            throw new IllegalArgumentException("Duplicate match id " + match.id());
        }
        Map<String, BracketMatch> updated = new LinkedHashMap<>(matches);
        updated.put(match.id(), match);
        ImmutableList<ImmutableList<String>> winners = winnerRounds;
        ImmutableList<ImmutableList<String>> losers = loserRounds;
        if (match.side() == BracketSide.WINNER) {
            winners = appendToRound(winnerRounds, match.round(), match.id());
        } else if (match.side() == BracketSide.LOSER) {
            losers = appendToRound(loserRounds, match.round(), match.id());
        } else if (match.side() != BracketSide.GRAND_FINAL) {
            throw new IllegalArgumentException("Unexpected side for appended match: " + match.id());
        }
        return new DoubleEliminationBracket(ImmutableMap.copyOf(updated), winners, losers, grandFinalId, resetEnabled);
    }

    private static ImmutableList<ImmutableList<String>> appendToRound(
            ImmutableList<ImmutableList<String>> rounds, int round, String id) {
        ImmutableList.Builder<ImmutableList<String>> builder = ImmutableList.builder();
        for (int i = 0; i < rounds.size(); i++) {
            if (i == round - 1) {
                builder.add(ImmutableList.<String>builder().addAll(rounds.get(i)).add(id).build());
            } else {
                builder.add(rounds.get(i));
            }
        }
        return builder.build();
    }

    @Override
    public Optional<BracketMatch> nextMatch() {
        return DoubleEliminationBracketEngine.getMatchesReadyForVoting(this).stream().findFirst();
    }

    @Override
    public DoubleEliminationBracket recordResult(String matchId, CompetitorId winner) {
        return DoubleEliminationBracketEngine.recordMatchResult(this, matchId, winner);
    }

    @Override
    @JsonIgnore
    public boolean isComplete() {
        return DoubleEliminationBracketEngine.isBracketComplete(this);
    }

    @Override
    public Optional<CompetitorId> champion() {
        if (!isComplete()) {
            return Optional.empty();
        }
        return resetMatch().orElse(grandFinal()).winner();
    }
}
