package com.dexarena.tournament.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchTest {

    private final CompetitorId alpha = CompetitorId.of("alpha");
    private final CompetitorId beta = CompetitorId.of("beta");

    @Test
    void recordResult_winUpdatesBothParticipants() {
        Participant a = new Participant(alpha);
        Participant b = new Participant(beta);
        Match match = Match.between(a, b, 0);

        match.recordResult(MatchResult.won(beta));

        assertEquals(0, a.score());
        assertEquals(1, a.losses());
        assertEquals(3, b.score());
        assertEquals(1, b.wins());
        assertTrue(match.isComplete());
    }

    @Test
    void recordResult_lossOutcomeStillCreditsNamedWinner() {
        Participant a = new Participant(alpha);
        Participant b = new Participant(beta);

        Match.between(a, b, 1).recordResult(MatchResult.of(Outcome.LOSS, alpha));

        assertEquals(3, a.score());
        assertEquals(1, b.losses());
    }

    @Test
    void recordResult_drawCreditsOnePointEach() {
        Participant a = new Participant(alpha);
        Participant b = new Participant(beta);

        Match.between(a, b, 0).recordResult(MatchResult.draw());

        assertEquals(1, a.score());
        assertEquals(1, b.score());
        assertEquals(1, a.draws());
    }

    @Test
    void recordResult_isWriteOnce() {
        Match match = Match.between(new Participant(alpha), new Participant(beta), 0);
        match.recordResult(MatchResult.draw());

        assertThrows(TournamentStateException.class, () -> match.recordResult(MatchResult.won(alpha)));
    }

    @Test
    void recordResult_rejectsWinnerOutsideMatch() {
        Match match = Match.between(new Participant(alpha), new Participant(beta), 0);

        assertThrows(InvalidTournamentInputException.class,
            () -> match.recordResult(MatchResult.won(CompetitorId.of("gamma"))));
        assertFalse(match.isComplete());
    }

    @Test
    void matchResult_drawWithWinnerIsInvalid() {
        assertThrows(InvalidTournamentInputException.class, () -> MatchResult.of(Outcome.DRAW, alpha));
        assertThrows(InvalidTournamentInputException.class, () -> MatchResult.of(Outcome.WIN, null));
        assertThrows(InvalidTournamentInputException.class, () -> MatchResult.of(Outcome.LOSS, null));
    }

    @Test
    void bye_recordsOneSidedWin() {
        Participant a = new Participant(alpha);
        Match bye = Match.bye(a, 2);
        bye.recordResult(MatchResult.won(alpha));

        MatchRecord record = bye.toRecord();
        assertTrue(record.isBye());
        assertEquals(2, record.round());
        assertEquals(3, a.score());
    }

    @Test
    void between_rejectsSelfMatch() {
        Participant a = new Participant(alpha);
        assertThrows(InvalidTournamentInputException.class, () -> Match.between(a, new Participant(alpha), 0));
    }

    @Test
    void participant_scoreStaysThreeTimesWinsPlusDraws() {
        Participant p = new Participant(alpha);
        p.addWin();
        p.addDraw();
        p.addLoss();
        p.addWin();

        assertEquals(3 * p.wins() + p.draws(), p.score());
        assertEquals(7, p.score());
    }

    @Test
    void outcome_parsesWireNamesCaseInsensitively() {
        assertEquals(Outcome.WIN, Outcome.fromString("WIN"));
        assertEquals(Outcome.DRAW, Outcome.fromString(" draw "));
        assertThrows(InvalidTournamentInputException.class, () -> Outcome.fromString("forfeit"));
    }
}
