package com.dexarena.tournament.format;

import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.google.common.math.IntMath;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A named tournament setup: Swiss qualification, optionally followed by a playoff
 * for the top {@code playoffCutoff} competitors. {@code playoffReset} only matters for
 * double elimination: when set, a loser-ladder champion who wins the grand final forces
 * a second, deciding grand final.
 */
public record TournamentFormat(
    String format,
    Optional<PlayoffType> playoff,
    OptionalInt playoffCutoff,
    boolean playoffReset
) {

    public static final String SWISS = "swiss-tournament";

    public TournamentFormat {
        Objects.requireNonNull(format, "format");
        playoff = playoff == null ? Optional.empty() : playoff;
        playoffCutoff = playoffCutoff == null ? OptionalInt.empty() : playoffCutoff;
        if (!SWISS.equals(format)) {
            throw new InvalidTournamentInputException("Unsupported format '" + format + "'");
        }
        if (playoff.isPresent()) {
            int cutoff = playoffCutoff.orElse(0);
            if (cutoff < 2) {
                throw new InvalidTournamentInputException("playoff-cutoff must be >= 2 when playoff is defined");
            }
            if (!IntMath.isPowerOfTwo(cutoff)) {
                throw new InvalidTournamentInputException("playoff-cutoff must be a power of two");
            }
            if (playoff.get() == PlayoffType.DOUBLE_ELIMINATION && cutoff != 16) {
                throw new InvalidTournamentInputException("double-elimination requires playoff-cutoff 16, got " + cutoff);
            }
        }
    }

    public static TournamentFormat swissOnly() {
        return new TournamentFormat(SWISS, Optional.empty(), OptionalInt.empty(), true);
    }

    public static TournamentFormat withPlayoff(PlayoffType playoff, int cutoff) {
        return withPlayoff(playoff, cutoff, true);
    }

    public static TournamentFormat withPlayoff(PlayoffType playoff, int cutoff, boolean reset) {
        return new TournamentFormat(SWISS, Optional.of(playoff), OptionalInt.of(cutoff), reset);
    }

    public boolean hasPlayoff() {
        return playoff.isPresent();
    }
}
