package com.dexarena.tournament.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompetitorIdTest {

    @Test
    void of_trimsAndLowercases() {
        assertEquals("pikachu", CompetitorId.of("  Pikachu ").value());
        assertEquals(CompetitorId.of("pikachu"), CompetitorId.of("PIKACHU"));
    }

    @Test
    void of_acceptsNumericDexIds() {
        CompetitorId id = CompetitorId.of("25");
        assertTrue(id.isNumeric());
        assertFalse(CompetitorId.of("mr-mime").isNumeric());
    }

    @Test
    void of_rejectsEmptyNullAndIllegalCharacters() {
        assertThrows(InvalidTournamentInputException.class, () -> CompetitorId.of(null));
        assertThrows(InvalidTournamentInputException.class, () -> CompetitorId.of("   "));
        assertThrows(InvalidTournamentInputException.class, () -> CompetitorId.of("farfetch'd"));
        assertThrows(InvalidTournamentInputException.class, () -> CompetitorId.of("../etc"));
    }

    @Test
    void of_rejectsOverlongValues() {
        assertDoesNotThrow(() -> CompetitorId.of("a".repeat(50)));
        assertThrows(InvalidTournamentInputException.class, () -> CompetitorId.of("a".repeat(51)));
    }

    @Test
    void compareTo_ordersByCanonicalForm() {
        List<CompetitorId> ids = new ArrayList<>(List.of(
            CompetitorId.of("Charmander"), CompetitorId.of("bulbasaur"), CompetitorId.of("abra")));
        Collections.sort(ids);
        assertEquals(List.of("abra", "bulbasaur", "charmander"), ids.stream().map(CompetitorId::toString).toList());
    }

    @Test
    void tournamentId_generatedValuesAreValidAndDistinct() {
        TournamentId first = TournamentId.generate();
        TournamentId second = TournamentId.generate();
        assertTrue(first.value().matches("tournament-\\d+-[0-9a-f]{8}"), first.value());
        assertNotEquals(first, second);
    }

    @Test
    void tournamentId_rejectsPathCharacters() {
        assertThrows(InvalidTournamentInputException.class, () -> TournamentId.of("ab"));
        assertThrows(InvalidTournamentInputException.class, () -> TournamentId.of("../secret"));
        assertThrows(InvalidTournamentInputException.class, () -> TournamentId.of("a".repeat(101)));
    }
}
