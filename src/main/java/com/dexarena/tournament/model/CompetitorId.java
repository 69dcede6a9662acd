package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier of a competing creature, either a name ("bulbasaur") or a numeric dex id ("25").
 * Values are trimmed and lower-cased, so "Pikachu " and "pikachu" are the same competitor.
 * The canonical string form is what gets stored and what standings ties are broken on.
 */
public record CompetitorId(String value) implements Comparable<CompetitorId> {

    private static final Pattern ALLOWED = Pattern.compile("[a-z0-9_-]+");
    private static final int MAX_LENGTH = 50;

    public CompetitorId {
        if (value == null) {
            throw new InvalidTournamentInputException("Competitor identifier cannot be null");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new InvalidTournamentInputException("Competitor identifier cannot be empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidTournamentInputException(
                "Competitor identifier cannot exceed " + MAX_LENGTH + " characters. Got: " + value);
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new InvalidTournamentInputException(
                "Competitor identifier must contain only letters, digits, hyphens and underscores. Got: " + value);
        }
    }

    @JsonCreator
    public static CompetitorId of(String value) {
        return new CompetitorId(value);
    }

    public boolean isNumeric() {
        return value.chars().allMatch(Character::isDigit);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }

    @Override
    public int compareTo(CompetitorId other) {
        return value.compareTo(other.value);
    }
}
