package com.dexarena.tournament.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TournamentTest {

    private static List<Participant> participants(String... names) {
        return java.util.Arrays.stream(names).map(CompetitorId::of).map(Participant::new).toList();
    }

    @Test
    void advanceRound_completesAtTotalRounds() {
        Tournament tournament = new Tournament(TournamentId.of("t-001"), "ash@example.com", participants("a", "b"), 2);

        assertFalse(tournament.isComplete());
        tournament.advanceRound();
        tournament.advanceRound();

        assertTrue(tournament.isComplete());
        assertEquals(2, tournament.currentRound());
        assertThrows(TournamentStateException.class, tournament::advanceRound);
    }

    @Test
    void zeroRoundTournament_isCompleteImmediately() {
        Tournament tournament = new Tournament(TournamentId.of("t-solo"), "misty", participants("onix"), 0);
        assertTrue(tournament.isComplete());
    }

    @Test
    void constructor_rejectsDuplicatesAndEmptyFields() {
        assertThrows(InvalidTournamentInputException.class,
            () -> new Tournament(TournamentId.of("t-dup"), "brock", participants("a", "A"), 3));
        assertThrows(InvalidTournamentInputException.class,
            () -> new Tournament(TournamentId.of("t-none"), "brock", List.of(), 3));
    }

    @Test
    void copy_doesNotShareParticipants() {
        Tournament original = new Tournament(TournamentId.of("t-copy"), "gary", participants("eevee", "vulpix"), 3);
        Tournament copy = original.copy();

        copy.participant(CompetitorId.of("eevee")).orElseThrow().addWin();
        copy.advanceRound();

        assertEquals(0, original.participant(CompetitorId.of("eevee")).orElseThrow().score());
        assertEquals(0, original.currentRound());
    }
}
