package com.dexarena.tournament.bracket;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.TournamentStateException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State machine over a 16-entrant double-elimination bracket.
 *
 * Advancement:
 * - Winner rounds 1-3: the winner moves to the next winner round, the loser drops into
 *   the loser round with the same number
 * - Winner round 4: the winner takes grand final slot 1, the loser is eliminated
 * - Loser rounds 1-4: the winner moves to the next loser round
 * - Loser round 5: the winner takes grand final slot 2
 * - Grand final: with reset enabled, a win from slot 2 creates the reset match
 *   between the same two competitors; otherwise the grand final decides
 *
 * Incoming competitors fill the first undecided match of a round that has an open slot,
 * or a new match appended to that round. Once every feeder of a loser round is decided,
 * a match there holding a single competitor is settled as a walkover.
 *
 * All operations are pure: they return a new bracket and never modify their input.
 */
public final class DoubleEliminationBracketEngine {

    public static final int BRACKET_SIZE = 16;
    public static final int WINNER_ROUNDS = 4;
    public static final int LOSER_ROUNDS = 5;
    public static final String GRAND_FINAL_ID = BracketSide.GRAND_FINAL.prefix();
    public static final String RESET_ID = GRAND_FINAL_ID + "2";

    private DoubleEliminationBracketEngine() {}

    /**
     * Builds the bracket from 16 competitors ordered best to worst. Seed {@code i}
     * meets seed {@code 15 - i} in winner round 1. The grand final has no reset.
     */
    public static DoubleEliminationBracket createBracket(List<CompetitorId> seeded) {
        return createBracket(seeded, false);
    }

    /**
     * Builds the bracket, optionally with a grand-final reset.
     */
    public static DoubleEliminationBracket createBracket(List<CompetitorId> seeded, boolean resetEnabled) {
        if (seeded == null || seeded.size() != BRACKET_SIZE) {
            throw new InvalidTournamentInputException(
                "Double elimination requires exactly " + BRACKET_SIZE + " participants, got "
                    + (seeded == null ? 0 : seeded.size()));
        }
        Set<CompetitorId> distinct = new HashSet<>(seeded);
        if (distinct.size() != BRACKET_SIZE || distinct.contains(null)) {
            throw new InvalidTournamentInputException("Seeded participants must be distinct");
        }

        Map<String, BracketMatch> matches = new LinkedHashMap<>();
        ImmutableList.Builder<String> firstRound = ImmutableList.builder();
        for (int i = 0; i < BRACKET_SIZE / 2; i++) {
            String id = BracketSide.WINNER.matchId(1, i + 1);
            matches.put(id, BracketMatch.of(id, BracketSide.WINNER, 1, seeded.get(i), seeded.get(BRACKET_SIZE - 1 - i)));
            firstRound.add(id);
        }
        matches.put(GRAND_FINAL_ID, BracketMatch.empty(GRAND_FINAL_ID, BracketSide.GRAND_FINAL, 1));

        ImmutableList.Builder<ImmutableList<String>> winnerRounds = ImmutableList.builder();
        winnerRounds.add(firstRound.build());
        for (int r = 2; r <= WINNER_ROUNDS; r++) {
            winnerRounds.add(ImmutableList.of());
        }
        ImmutableList.Builder<ImmutableList<String>> loserRounds = ImmutableList.builder();
        for (int r = 1; r <= LOSER_ROUNDS; r++) {
            loserRounds.add(ImmutableList.of());
        }
        return new DoubleEliminationBracket(
            ImmutableMap.copyOf(matches), winnerRounds.build(), loserRounds.build(), GRAND_FINAL_ID, resetEnabled);
    }

    /**
     * Returns the next match to vote on: the first undecided match in scan order
     * (winner rounds, loser rounds, grand final, reset), if it is ready. At most one entry.
     */
    public static List<BracketMatch> getMatchesReadyForVoting(DoubleEliminationBracket bracket) {
        if (isBracketComplete(bracket)) {
            return List.of();
        }
        for (BracketMatch match : bracket.allMatches()) {
            if (!match.isDecided()) {
                return match.isReady() ? List.of(match) : List.of();
            }
        }
        return List.of();
    }

    /**
     * Records the winner of one match and routes both competitors onward.
     *
     * @throws InvalidTournamentInputException if the match id is unknown or the winner
     *         is not one of its participants
     * @throws TournamentStateException if the match is already decided or still waiting
     *         for a participant
     */
    public static DoubleEliminationBracket recordMatchResult(
            DoubleEliminationBracket bracket, String matchId, CompetitorId winner) {
        BracketMatch match = bracket.match(matchId)
            .orElseThrow(() -> new InvalidTournamentInputException("Unknown bracket match: " + matchId));
        if (match.isDecided()) {
            throw new TournamentStateException("Bracket match " + matchId + " is already decided");
        }
        if (isBracketComplete(bracket)) {
            throw new TournamentStateException("Bracket is already complete");
        }
        if (winner == null || !match.involves(winner)) {
            throw new InvalidTournamentInputException(
                "Winner " + winner + " is not a participant of bracket match " + matchId);
        }
        if (!match.isReady()) {
            throw new TournamentStateException("Bracket match " + matchId + " is still waiting for an opponent");
        }

        BracketMatch decided = match.withWinner(winner);
        DoubleEliminationBracket next = advance(bracket.withMatch(decided), decided, decided.loserFor(winner));
        return settleWalkovers(next);
    }

    /**
     * A bracket is complete once its reset match is decided, or once the grand final is
     * decided and no reset is owed.
     */
    public static boolean isBracketComplete(DoubleEliminationBracket bracket) {
        Optional<BracketMatch> reset = bracket.resetMatch();
        if (reset.isPresent()) {
            return reset.get().isDecided();
        }
        BracketMatch grandFinal = bracket.grandFinal();
        return grandFinal.isDecided() && !owesReset(bracket, grandFinal);
    }

    private static boolean owesReset(DoubleEliminationBracket bracket, BracketMatch grandFinal) {
        return bracket.resetEnabled() && grandFinal.winner().equals(grandFinal.participant2());
    }

    private static DoubleEliminationBracket advance(
            DoubleEliminationBracket bracket, BracketMatch decided, Optional<CompetitorId> loser) {
        CompetitorId winner = decided.winner().orElseThrow();
        int round = decided.round();
        switch (decided.side()) {
            case WINNER -> {
                if (round < WINNER_ROUNDS) {
                    bracket = fill(bracket, BracketSide.WINNER, round + 1, winner);
                    if (loser.isPresent()) {
                        bracket = fill(bracket, BracketSide.LOSER, round, loser.get());
                    }
                } else {
                    bracket = bracket.withMatch(bracket.grandFinal().withParticipant1(winner));
                }
            }
            case LOSER -> {
                if (round < LOSER_ROUNDS) {
                    bracket = fill(bracket, BracketSide.LOSER, round + 1, winner);
                } else {
                    bracket = bracket.withMatch(bracket.grandFinal().withParticipant2(winner));
                }
            }
            default -> {
                if (decided.id().equals(GRAND_FINAL_ID) && owesReset(bracket, decided)) {
                    bracket = bracket.withAppendedMatch(BracketMatch.of(
                        RESET_ID, BracketSide.GRAND_FINAL, 2,
                        decided.participant1().orElseThrow(), decided.participant2().orElseThrow()));
                }
            }
        }
        return bracket;
    }

    private static DoubleEliminationBracket fill(
            DoubleEliminationBracket bracket, BracketSide side, int round, CompetitorId competitor) {
        List<BracketMatch> matches = bracket.round(side, round);
        for (BracketMatch candidate : matches) {
            if (!candidate.isDecided() && candidate.hasOpenSlot()) {
                return bracket.withMatch(candidate.withEntrant(competitor));
            }
        }
        String id = side.matchId(round, matches.size() + 1);
        return bracket.withAppendedMatch(
            new BracketMatch(id, side, round, Optional.of(competitor), Optional.empty(), Optional.empty()));
    }

    private static DoubleEliminationBracket settleWalkovers(DoubleEliminationBracket bracket) {
        boolean settled = true;
        while (settled) {
            settled = false;
            for (int r = 1; r <= LOSER_ROUNDS && !settled; r++) {
                if (!loserFeedersComplete(bracket, r)) {
                    continue;
                }
                for (BracketMatch match : bracket.round(BracketSide.LOSER, r)) {
                    if (!match.isDecided() && match.entrants().size() == 1) {
                        BracketMatch walkover = match.withWinner(match.entrants().get(0));
                        bracket = advance(bracket.withMatch(walkover), walkover, Optional.empty());
                        settled = true;
                        break;
                    }
                }
            }
        }
        return bracket;
    }

    private static boolean winnerRoundComplete(DoubleEliminationBracket bracket, int round) {
        List<BracketMatch> matches = bracket.round(BracketSide.WINNER, round);
        return matches.size() == (BRACKET_SIZE / 2) >> (round - 1)
            && matches.stream().allMatch(BracketMatch::isDecided);
    }

    private static boolean loserFeedersComplete(DoubleEliminationBracket bracket, int round) {
        boolean winnerFeederDone = round >= WINNER_ROUNDS || winnerRoundComplete(bracket, round);
        return winnerFeederDone && (round == 1 || loserRoundComplete(bracket, round - 1));
    }

    private static boolean loserRoundComplete(DoubleEliminationBracket bracket, int round) {
        return loserFeedersComplete(bracket, round)
            && bracket.round(BracketSide.LOSER, round).stream().allMatch(BracketMatch::isDecided);
    }
}
