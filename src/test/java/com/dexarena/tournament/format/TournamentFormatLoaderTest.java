package com.dexarena.tournament.format;

import com.dexarena.tournament.model.InvalidTournamentInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TournamentFormatLoaderTest {

    private static final String TEST_FORMATS = "test-formats.yaml";

    private final TournamentFormatLoader loader = new TournamentFormatLoader();

    @TempDir
    Path tempDir;

    @Test
    void loadResource_readsDoubleEliminationSetup() {
        TournamentFormat format = loader.loadResource(TEST_FORMATS, "favorite-monster");

        assertEquals(TournamentFormat.SWISS, format.format());
        assertEquals(Optional.of(PlayoffType.DOUBLE_ELIMINATION), format.playoff());
        assertEquals(OptionalInt.of(16), format.playoffCutoff());
        assertTrue(format.hasPlayoff());
    }

    @Test
    void loadResource_readsPlayoffReset() {
        assertTrue(loader.loadResource(TEST_FORMATS, "favorite-monster").playoffReset());
        assertEquals(TournamentFormat.withPlayoff(PlayoffType.DOUBLE_ELIMINATION, 16, false),
            loader.loadResource(TEST_FORMATS, "no-reset"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource(TEST_FORMATS, "bad-reset"));
    }

    @Test
    void loadResource_defaultsFormatToSwiss() {
        TournamentFormat format = loader.loadResource(TEST_FORMATS, "top-four");

        assertEquals(TournamentFormat.withPlayoff(PlayoffType.SINGLE_ELIMINATION, 4), format);
    }

    @Test
    void loadResource_rejectsInvalidSetups() {
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource(TEST_FORMATS, "bad-cutoff"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource(TEST_FORMATS, "missing-cutoff"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource(TEST_FORMATS, "unknown-format"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource(TEST_FORMATS, "unknown-playoff"));
    }

    @Test
    void loadResource_unknownKeyOrResource() {
        InvalidTournamentInputException e = assertThrows(InvalidTournamentInputException.class,
            () -> loader.loadResource(TEST_FORMATS, "nope"));
        assertTrue(e.getMessage().contains("'nope' not found"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.loadResource("missing.yaml", "x"));
    }

    @Test
    void loadResource_bundledFormatsAreValid() {
        assertEquals(16, loader.loadResource("formats.yaml", "favorite-monster").playoffCutoff().getAsInt());
        assertEquals(Optional.of(PlayoffType.SINGLE_ELIMINATION),
            loader.loadResource("formats.yaml", "quick-top-eight").playoff());
        assertFalse(loader.loadResource("formats.yaml", "swiss-only").hasPlayoff());
    }

    @Test
    void load_readsFileFromDisk() throws IOException {
        Path file = tempDir.resolve("league.yaml");
        Files.writeString(file, """
            weekly:
              format: swiss-tournament
              playoff: single-elimination
              playoff-cutoff: 8
            """);

        TournamentFormat format = loader.load(file, "weekly");

        assertEquals(OptionalInt.of(8), format.playoffCutoff());
    }

    @Test
    void load_rejectsNonIntegerCutoffAndMissingFile() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, """
            weekly:
              playoff: single-elimination
              playoff-cutoff: eight
            """);

        assertThrows(InvalidTournamentInputException.class, () -> loader.load(file, "weekly"));
        assertThrows(InvalidTournamentInputException.class, () -> loader.load(tempDir.resolve("absent.yaml"), "weekly"));
    }

    @Test
    void tournamentFormat_validatesCutoff() {
        assertThrows(InvalidTournamentInputException.class,
            () -> TournamentFormat.withPlayoff(PlayoffType.DOUBLE_ELIMINATION, 8));
        assertThrows(InvalidTournamentInputException.class,
            () -> TournamentFormat.withPlayoff(PlayoffType.SINGLE_ELIMINATION, 1));
        assertThrows(InvalidTournamentInputException.class,
            () -> PlayoffType.fromConfigName("round-robin"));
        assertEquals("single-elimination", PlayoffType.SINGLE_ELIMINATION.configName());
    }
}
