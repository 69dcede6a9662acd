package com.dexarena.tournament.swiss;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.Outcome;
import com.dexarena.tournament.model.ScoredCompetitor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SwissPairingEngineTest {

    private static CompetitorId id(String name) {
        return CompetitorId.of(name);
    }

    private static List<CompetitorId> ids(String... names) {
        return Arrays.stream(names).map(CompetitorId::of).toList();
    }

    private static Map<CompetitorId, Integer> scores(Object... nameScorePairs) {
        Map<CompetitorId, Integer> scores = new HashMap<>();
        for (int i = 0; i < nameScorePairs.length; i += 2) {
            scores.put(id((String) nameScorePairs[i]), (Integer) nameScorePairs[i + 1]);
        }
        return scores;
    }

    private static void assertCoversEachOnce(List<CompetitorId> participants, List<Pairing> pairings) {
        List<CompetitorId> seen = new ArrayList<>();
        pairings.forEach(p -> seen.addAll(p.members()));
        assertEquals(participants.size(), seen.size(), "every participant appears exactly once");
        assertEquals(new HashSet<>(participants), new HashSet<>(seen));
    }

    @Test
    void generatePairings_firstRoundPairsInGivenOrder() {
        List<CompetitorId> participants = ids("a", "b", "c", "d");

        List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, List.of(), Map.of());

        assertEquals(List.of(Pairing.of(id("a"), id("b")), Pairing.of(id("c"), id("d"))), pairings);
    }

    @Test
    void generatePairings_oddFieldGivesLowestScoreTheBye() {
        List<CompetitorId> participants = ids("a", "b", "c", "d", "e");

        List<Pairing> pairings = SwissPairingEngine.generatePairings(
            participants, List.of(), scores("a", 6, "b", 3, "c", 3, "d", 3, "e", 0));

        assertEquals(List.of(
            Pairing.of(id("a"), id("b")),
            Pairing.of(id("c"), id("d")),
            Pairing.bye(id("e"))), pairings);
    }

    @Test
    void generatePairings_avoidsRematches() {
        List<CompetitorId> participants = ids("a", "b", "c", "d");
        List<Pairing> history = List.of(Pairing.of(id("a"), id("b")), Pairing.of(id("c"), id("d")));

        List<Pairing> pairings = SwissPairingEngine.generatePairings(
            participants, history, scores("a", 3, "b", 0, "c", 3, "d", 0));

        assertEquals(List.of(Pairing.of(id("a"), id("c")), Pairing.of(id("b"), id("d"))), pairings);
    }

    @Test
    void generatePairings_historyIsMatchedAsUnorderedPairs() {
        List<CompetitorId> participants = ids("a", "b", "c", "d");
        List<Pairing> history = List.of(Pairing.of(id("b"), id("a")));

        List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, history, Map.of());

        assertFalse(pairings.contains(Pairing.of(id("a"), id("b"))));
        assertCoversEachOnce(participants, pairings);
    }

    @Test
    void generatePairings_twoPlayersRematchInsteadOfByes() {
        List<CompetitorId> participants = ids("a", "b");
        List<Pairing> history = List.of(Pairing.of(id("a"), id("b")), Pairing.of(id("a"), id("b")));

        List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, history, scores("a", 6, "b", 0));

        assertEquals(List.of(Pairing.of(id("a"), id("b"))), pairings);
    }

    @Test
    void generatePairings_exhaustedTrioStillGetsExactlyOneBye() {
        List<CompetitorId> participants = ids("a", "b", "c");
        List<Pairing> history = List.of(
            Pairing.of(id("a"), id("b")), Pairing.of(id("a"), id("c")), Pairing.of(id("b"), id("c")));

        List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, history, Map.of());

        assertEquals(1, pairings.stream().filter(Pairing::isBye).count());
        assertCoversEachOnce(participants, pairings);
    }

    @Test
    void generatePairings_singleParticipantGetsBye() {
        assertEquals(List.of(Pairing.bye(id("solo"))),
            SwissPairingEngine.generatePairings(ids("solo"), List.of(), Map.of()));
    }

    @Test
    void generatePairings_rejectsEmptyInput() {
        assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.generatePairings(List.of(), List.of(), Map.of()));
        assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.generatePairings(null, List.of(), Map.of()));
    }

    @Test
    void generatePairings_rejectsDuplicateParticipants() {
        InvalidTournamentInputException e = assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.generatePairings(ids("a", "b", "a"), List.of(), Map.of()));
        assertTrue(e.getMessage().contains("Duplicate participant"), e.getMessage());
        assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.generatePairings(ids("a", "a"), List.of(), Map.of()));
    }

    @Test
    void generatePairings_rejectsMissingScore() {
        Map<CompetitorId, Integer> standings = new HashMap<>();
        standings.put(id("a"), 3);
        standings.put(id("b"), null);

        assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.generatePairings(ids("a", "b", "c"), List.of(), standings));
    }

    @Test
    void generatePairings_isDeterministic() {
        List<CompetitorId> participants = ids("m", "k", "z", "b", "q", "a", "x");
        List<Pairing> history = List.of(Pairing.of(id("m"), id("k")), Pairing.of(id("z"), id("b")));
        Map<CompetitorId, Integer> standings = scores("m", 3, "k", 0, "z", 3, "b", 0, "q", 3, "a", 1, "x", 1);

        List<Pairing> first = SwissPairingEngine.generatePairings(participants, history, standings);
        List<Pairing> second = SwissPairingEngine.generatePairings(participants, history, standings);

        assertEquals(first, second);
    }

    @Test
    void generatePairings_byeCountMatchesFieldParityAcrossRandomHistories() {
        Random random = new Random(42);
        for (int trial = 0; trial < 200; trial++) {
            int size = 2 + random.nextInt(15);
            List<CompetitorId> participants = new ArrayList<>();
            Map<CompetitorId, Integer> standings = new HashMap<>();
            for (int i = 0; i < size; i++) {
                CompetitorId c = id("p" + i);
                participants.add(c);
                standings.put(c, 3 * random.nextInt(4));
            }
            List<Pairing> history = new ArrayList<>();
            for (int k = 0; k < size * 2; k++) {
                int x = random.nextInt(size);
                int y = random.nextInt(size);
                if (x != y) {
                    history.add(Pairing.of(participants.get(x), participants.get(y)));
                }
            }

            List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, history, standings);

            assertEquals(size % 2, pairings.stream().filter(Pairing::isBye).count(), "size " + size);
            assertCoversEachOnce(participants, pairings);
        }
    }

    @Test
    void generatePairings_preferUnplayedOpponentWhenOneExists() {
        List<CompetitorId> participants = ids("a", "b", "c", "d");
        // a has played everyone except d
        List<Pairing> history = List.of(Pairing.of(id("a"), id("b")), Pairing.of(id("a"), id("c")));

        List<Pairing> pairings = SwissPairingEngine.generatePairings(participants, history, Map.of());

        assertTrue(pairings.contains(Pairing.of(id("a"), id("d"))));
        assertTrue(pairings.contains(Pairing.of(id("b"), id("c"))));
    }

    @Test
    void calculateTotalRounds_clampsLogarithm() {
        assertEquals(0, SwissPairingEngine.calculateTotalRounds(1));
        assertEquals(3, SwissPairingEngine.calculateTotalRounds(2));
        assertEquals(3, SwissPairingEngine.calculateTotalRounds(8));
        assertEquals(4, SwissPairingEngine.calculateTotalRounds(9));
        assertEquals(5, SwissPairingEngine.calculateTotalRounds(17));
        assertEquals(8, SwissPairingEngine.calculateTotalRounds(256));
        assertEquals(8, SwissPairingEngine.calculateTotalRounds(1000));
    }

    @Test
    void calculateTotalRounds_neverDecreases() {
        int previous = 0;
        for (int n = 1; n <= 600; n++) {
            int rounds = SwissPairingEngine.calculateTotalRounds(n);
            assertTrue(rounds >= previous, "rounds dropped at " + n);
            previous = rounds;
        }
    }

    @Test
    void calculateTotalRounds_rejectsNonPositiveCounts() {
        assertThrows(InvalidTournamentInputException.class, () -> SwissPairingEngine.calculateTotalRounds(0));
        assertThrows(InvalidTournamentInputException.class, () -> SwissPairingEngine.calculateTotalRounds(-1));
    }

    @Test
    void sortStandingsByTieBreaker_ordersByScoreThenIdentifier() {
        Map<CompetitorId, Integer> standings = scores("charmander", 3, "abra", 3, "zubat", 9, "eevee", 0, "ghost", 6);

        List<ScoredCompetitor> sorted = SwissPairingEngine.sortStandingsByTieBreaker(
            standings, ids("charmander", "abra", "zubat", "eevee"));

        assertEquals(List.of(
            new ScoredCompetitor(id("zubat"), 9),
            new ScoredCompetitor(id("abra"), 3),
            new ScoredCompetitor(id("charmander"), 3),
            new ScoredCompetitor(id("eevee"), 0)), sorted);
    }

    @Test
    void getScoreForResult_mapsOutcomes() {
        assertEquals(3, SwissPairingEngine.getScoreForResult(Outcome.WIN));
        assertEquals(1, SwissPairingEngine.getScoreForResult("draw"));
        assertEquals(0, SwissPairingEngine.getScoreForResult("LOSS"));
        assertThrows(InvalidTournamentInputException.class, () -> SwissPairingEngine.getScoreForResult("bye"));
        assertThrows(InvalidTournamentInputException.class,
            () -> SwissPairingEngine.getScoreForResult((Outcome) null));
    }

    @Test
    void calculateStandings_creditsWinnersDrawsAndByes() {
        List<CompetitorId> participants = ids("a", "b", "c", "d");
        List<MatchRecord> results = List.of(
            new MatchRecord(0, id("a"), Optional.of(id("b")), Outcome.WIN, Optional.of(id("a"))),
            new MatchRecord(0, id("c"), Optional.of(id("d")), Outcome.DRAW, Optional.empty()),
            new MatchRecord(1, id("b"), Optional.of(id("a")), Outcome.LOSS, Optional.of(id("a"))),
            new MatchRecord(1, id("c"), Optional.empty(), Outcome.WIN, Optional.of(id("c"))));

        Map<CompetitorId, Integer> standings = SwissPairingEngine.calculateStandings(participants, results);

        assertEquals(6, standings.get(id("a")));
        assertEquals(0, standings.get(id("b")));
        assertEquals(4, standings.get(id("c")));
        assertEquals(1, standings.get(id("d")));
        assertEquals(participants, List.copyOf(standings.keySet()));
    }

    @Test
    void pairing_keyIsOrderIndependent() {
        assertEquals(Pairing.of(id("b"), id("a")).key(), Pairing.of(id("a"), id("b")).key());
        Set<String> keys = Set.of(Pairing.matchupKey(id("x"), id("y")));
        assertTrue(keys.contains("x:y"));
        assertThrows(IllegalStateException.class, () -> Pairing.bye(id("x")).key());
    }
}
