package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a qualification match. WIN and LOSS both name a winner; DRAW never does.
 */
public enum Outcome {
    WIN(3),
    LOSS(0),
    DRAW(1);

    private final int points;

    Outcome(int points) {
        this.points = points;
    }

    /**
     * Points this outcome is worth on the 3-0-1 scale.
     */
    public int points() {
        return points;
    }

    public boolean hasWinner() {
        return this != DRAW;
    }

    @JsonCreator
    public static Outcome fromString(String value) {
        if (value == null) {
            throw new InvalidTournamentInputException("Outcome cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "win" -> WIN;
            case "loss" -> LOSS;
            case "draw" -> DRAW;
            default -> throw new InvalidTournamentInputException(
                "Invalid outcome: " + value + ". Must be 'win', 'loss', or 'draw'");
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
