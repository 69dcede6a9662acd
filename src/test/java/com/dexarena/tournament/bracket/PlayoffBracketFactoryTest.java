package com.dexarena.tournament.bracket;

import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.Participant;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlayoffBracketFactoryTest {

    private static CompetitorId id(String name) {
        return CompetitorId.of(name);
    }

    /** p1..pN, with p1 on top. */
    private static Map<CompetitorId, Integer> descendingStandings(int count) {
        Map<CompetitorId, Integer> standings = new HashMap<>();
        for (int i = 1; i <= count; i++) {
            standings.put(id("p" + i), 100 - i);
        }
        return standings;
    }

    private static List<Participant> pool(int count) {
        List<Participant> pool = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            pool.add(new Participant(id("p" + i)));
        }
        return pool;
    }

    @Test
    void seedTopN_ordersByScoreThenIdentifier() {
        Map<CompetitorId, Integer> standings = Map.of(id("b"), 3, id("a"), 3, id("c"), 9, id("d"), 0);

        List<Participant> seeded = PlayoffBracketFactory.seedTopN(List.of(), standings, 3);

        assertEquals(List.of(id("c"), id("a"), id("b")), seeded.stream().map(Participant::id).toList());
    }

    @Test
    void seedTopN_reusesPoolInstancesAndCreatesPlaceholders() {
        Participant known = new Participant(id("known"));
        known.addWin();
        Map<CompetitorId, Integer> standings = Map.of(id("known"), 3, id("outsider"), 1);

        List<Participant> seeded = PlayoffBracketFactory.seedTopN(List.of(known), standings, 2);

        assertSame(known, seeded.get(0));
        assertEquals(id("outsider"), seeded.get(1).id());
        assertEquals(0, seeded.get(1).score());
    }

    @Test
    void seedTopN_rejectsNonPositiveSize() {
        assertThrows(InvalidTournamentInputException.class,
            () -> PlayoffBracketFactory.seedTopN(List.of(), descendingStandings(4), 0));
    }

    @Test
    void createTopDoubleElimination_seedsTopSixteen() {
        DoubleEliminationBracket bracket =
            PlayoffBracketFactory.createTopDoubleElimination(pool(32), descendingStandings(32));

        BracketMatch first = bracket.round(BracketSide.WINNER, 1).get(0);
        assertEquals(Optional.of(id("p1")), first.participant1());
        assertEquals(Optional.of(id("p16")), first.participant2());
        assertTrue(bracket.allMatches().stream().noneMatch(m -> m.involves(id("p17"))));
    }

    @Test
    void createTopSingleElimination_rejectsTooSmallCut() {
        assertThrows(InvalidTournamentInputException.class,
            () -> PlayoffBracketFactory.createTopSingleElimination(pool(4), descendingStandings(4), 1));
    }

    @Test
    void createFromStandings_followsFormat() {
        PlayoffBracket single = PlayoffBracketFactory.createFromStandings(
            pool(10), descendingStandings(10), TournamentFormat.withPlayoff(PlayoffType.SINGLE_ELIMINATION, 8));
        assertInstanceOf(SingleEliminationBracket.class, single);
        assertEquals(List.of(id("p1"), id("p8")), single.nextMatch().orElseThrow().entrants());

        PlayoffBracket dbl = PlayoffBracketFactory.createFromStandings(
            pool(20), descendingStandings(20), TournamentFormat.withPlayoff(PlayoffType.DOUBLE_ELIMINATION, 16));
        assertInstanceOf(DoubleEliminationBracket.class, dbl);
    }

    @Test
    void createFromStandings_carriesGrandFinalReset() {
        DoubleEliminationBracket withReset = (DoubleEliminationBracket) PlayoffBracketFactory.createFromStandings(
            pool(16), descendingStandings(16), TournamentFormat.withPlayoff(PlayoffType.DOUBLE_ELIMINATION, 16));
        DoubleEliminationBracket withoutReset = (DoubleEliminationBracket) PlayoffBracketFactory.createFromStandings(
            pool(16), descendingStandings(16),
            TournamentFormat.withPlayoff(PlayoffType.DOUBLE_ELIMINATION, 16, false));

        assertTrue(withReset.resetEnabled());
        assertFalse(withoutReset.resetEnabled());
        assertFalse(PlayoffBracketFactory.createTopDoubleElimination(pool(16), descendingStandings(16)).resetEnabled());
    }

    @Test
    void createFromStandings_rejectsMissingPlayoffOrShortField() {
        assertThrows(InvalidTournamentInputException.class, () -> PlayoffBracketFactory.createFromStandings(
            pool(8), descendingStandings(8), TournamentFormat.swissOnly()));
        assertThrows(InvalidTournamentInputException.class, () -> PlayoffBracketFactory.createFromStandings(
            pool(6), descendingStandings(6), TournamentFormat.withPlayoff(PlayoffType.SINGLE_ELIMINATION, 8)));
    }
}
