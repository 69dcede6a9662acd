package com.dexarena.tournament.swiss;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.Outcome;
import com.dexarena.tournament.model.ScoredCompetitor;
import com.google.common.math.IntMath;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Swiss-system pairing, round counts and tie-break ordering.
 *
 * Key design principles:
 * - Competitors with similar scores meet each other
 * - Nobody meets the same opponent twice while an unplayed opponent is still available
 * - A round hands out at most one bye, and only when the field is odd
 * - Identical input always yields identical pairings
 */
public final class SwissPairingEngine {

    private static final int MIN_ROUNDS = 3;
    private static final int MAX_ROUNDS = 8;

    private static final Comparator<ScoredCompetitor> TIE_BREAK_ORDER =
        Comparator.comparingInt(ScoredCompetitor::score).reversed()
            .thenComparing(ScoredCompetitor::participant);

    private SwissPairingEngine() {}

    /**
     * Generates pairings for the next round.
     *
     * <p>When standings are given, competitors are ordered by score (descending) and
     * identifier (ascending) first; that order is also the greedy pairing priority.
     * Each unpaired competitor takes the unpaired candidate, later in the order, with the
     * smallest score difference that it has not played yet; ties go to the first candidate found.
     * A competitor with no unplayed candidate gets the bye if the round still has one to give
     * and everyone left can still be paired; otherwise it takes a rematch with the
     * closest-scored remaining candidate.
     *
     * @param participants      competitors to pair (non-empty)
     * @param previousMatchups  earlier two-member pairings, matched as unordered pairs
     * @param standings         current scores by competitor; may be empty
     * @return pairings of one or two members covering every competitor exactly once
     * @throws InvalidTournamentInputException if participants are empty or repeat an id,
     *         or a standings entry has no score
     */
    public static List<Pairing> generatePairings(
            List<CompetitorId> participants,
            Collection<Pairing> previousMatchups,
            Map<CompetitorId, Integer> standings) {
        if (participants == null || participants.isEmpty()) {
            throw new InvalidTournamentInputException("Cannot generate pairings for empty participants list");
        }
        Set<CompetitorId> distinct = new HashSet<>();
        for (CompetitorId participant : participants) {
            if (participant == null) {
                throw new InvalidTournamentInputException("Participants cannot contain null");
            }
            if (!distinct.add(participant)) {
                throw new InvalidTournamentInputException("Duplicate participant: " + participant);
            }
        }
        Map<CompetitorId, Integer> scores = standings == null ? Map.of() : standings;
        for (Map.Entry<CompetitorId, Integer> entry : scores.entrySet()) {
            if (entry.getValue() == null) {
                throw new InvalidTournamentInputException("Missing score for " + entry.getKey());
            }
        }
        if (participants.size() == 1) {
            return List.of(Pairing.bye(participants.get(0)));
        }

        List<CompetitorId> ordered = new ArrayList<>(participants);
        if (!scores.isEmpty()) {
            ordered.sort(Comparator
                .comparingInt((CompetitorId c) -> scoreOf(c, scores)).reversed()
                .thenComparing(Comparator.naturalOrder()));
        }

        Set<String> played = new HashSet<>();
        for (Pairing matchup : previousMatchups == null ? List.<Pairing>of() : previousMatchups) {
            if (!matchup.isBye()) {
                played.add(matchup.key());
            }
        }

        int n = ordered.size();
        boolean[] used = new boolean[n];
        int unpaired = n;
        boolean byeGiven = false;
        List<Pairing> pairings = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            if (used[i]) {
                continue;
            }
            CompetitorId current = ordered.get(i);
            used[i] = true;
            unpaired--;

            int opponent = findBestOpponent(ordered, used, i, played, scores, true);
            if (opponent < 0) {
                // Giving a bye here must leave an even pool behind, or a second bye would follow
                boolean byeAllowed = unpaired == 0 || (!byeGiven && unpaired % 2 == 0);
                if (!byeAllowed) {
                    opponent = findBestOpponent(ordered, used, i, played, scores, false);
                }
            }

            if (opponent >= 0) {
                used[opponent] = true;
                unpaired--;
                pairings.add(Pairing.of(current, ordered.get(opponent)));
            } else {
                byeGiven = true;
                pairings.add(Pairing.bye(current));
            }
        }
        return pairings;
    }

    /**
     * Number of Swiss rounds for a field: {@code ceil(log2(n))}, clamped to [3, 8].
     * A single competitor needs no rounds at all.
     */
    public static int calculateTotalRounds(int participantCount) {
        if (participantCount <= 0) {
            throw new InvalidTournamentInputException("Participant count must be positive");
        }
        if (participantCount == 1) {
            return 0;
        }
        int logRounds = IntMath.log2(participantCount, RoundingMode.CEILING);
        return Math.max(MIN_ROUNDS, Math.min(MAX_ROUNDS, logRounds));
    }

    /**
     * Orders standings by score (descending), then identifier (ascending).
     * Entries for competitors outside {@code participants} are dropped.
     */
    public static List<ScoredCompetitor> sortStandingsByTieBreaker(
            Map<CompetitorId, Integer> standings,
            Collection<CompetitorId> participants) {
        Set<CompetitorId> known = new HashSet<>(participants);
        List<ScoredCompetitor> sorted = new ArrayList<>();
        for (Map.Entry<CompetitorId, Integer> entry : standings.entrySet()) {
            if (known.contains(entry.getKey())) {
                sorted.add(new ScoredCompetitor(entry.getKey(), entry.getValue()));
            }
        }
        sorted.sort(TIE_BREAK_ORDER);
        return sorted;
    }

    public static int getScoreForResult(Outcome outcome) {
        if (outcome == null) {
            throw new InvalidTournamentInputException("Outcome cannot be null");
        }
        return outcome.points();
    }

    public static int getScoreForResult(String outcome) {
        return getScoreForResult(Outcome.fromString(outcome));
    }

    /**
     * Recomputes scores from raw results. Every participant starts at zero; a win
     * credits the recorded winner with 3, a draw credits both sides with 1.
     */
    public static Map<CompetitorId, Integer> calculateStandings(
            List<CompetitorId> participants,
            Collection<MatchRecord> results) {
        Map<CompetitorId, Integer> standings = new LinkedHashMap<>();
        for (CompetitorId participant : participants) {
            standings.put(participant, 0);
        }
        for (MatchRecord result : results) {
            if (result.outcome() == Outcome.DRAW) {
                standings.merge(result.participant1(), Outcome.DRAW.points(), Integer::sum);
                result.participant2().ifPresent(p -> standings.merge(p, Outcome.DRAW.points(), Integer::sum));
            } else {
                result.winner().ifPresent(w -> standings.merge(w, Outcome.WIN.points(), Integer::sum));
            }
        }
        return standings;
    }

    private static int findBestOpponent(
            List<CompetitorId> ordered,
            boolean[] used,
            int index,
            Set<String> played,
            Map<CompetitorId, Integer> standings,
            boolean avoidRematches) {
        CompetitorId participant = ordered.get(index);
        int best = -1;
        int bestDifference = Integer.MAX_VALUE;

        for (int j = index + 1; j < ordered.size(); j++) {
            if (used[j]) {
                continue;
            }
            CompetitorId candidate = ordered.get(j);
            if (avoidRematches && played.contains(Pairing.matchupKey(participant, candidate))) {
                continue;
            }
            int difference = Math.abs(scoreOf(participant, standings) - scoreOf(candidate, standings));
            if (difference < bestDifference) {
                bestDifference = difference;
                best = j;
            }
        }
        return best;
    }

    private static int scoreOf(CompetitorId competitor, Map<CompetitorId, Integer> standings) {
        return standings.getOrDefault(competitor, 0);
    }
}
