package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Identifier of a tournament. Doubles as its storage directory name, so the
 * allowed alphabet is kept path-safe.
 */
public record TournamentId(String value) {

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]{3,100}");
    private static final SecureRandom RANDOM = new SecureRandom();

    public TournamentId {
        if (value == null) {
            throw new InvalidTournamentInputException("Tournament identifier cannot be null");
        }
        value = value.trim();
        if (!ALLOWED.matcher(value).matches()) {
            throw new InvalidTournamentInputException(
                "Tournament identifier must be 3-100 letters, digits, hyphens or underscores. Got: " + value);
        }
    }

    @JsonCreator
    public static TournamentId of(String value) {
        return new TournamentId(value);
    }

    /**
     * Generates a fresh identifier of the form {@code tournament-<epochSeconds>-<8 hex chars>}.
     */
    public static TournamentId generate() {
        byte[] random = new byte[4];
        RANDOM.nextBytes(random);
        return new TournamentId("tournament-" + Instant.now().getEpochSecond() + "-" + HexFormat.of().formatHex(random));
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
