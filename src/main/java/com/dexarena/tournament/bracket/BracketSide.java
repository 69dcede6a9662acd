package com.dexarena.tournament.bracket;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Which part of an elimination bracket a match belongs to. The prefix is part of
 * every match id, e.g. {@code w2_3} or {@code l4_1}.
 */
public enum BracketSide {
    WINNER("w"),
    LOSER("l"),
    GRAND_FINAL("gf"),
    SINGLE("s");

    private final String prefix;

    BracketSide(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String matchId(int round, int sequence) {
        return prefix + round + "_" + sequence;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }

    @JsonCreator
    public static BracketSide fromWireName(String value) {
        return Arrays.stream(values())
            .filter(side -> side.wireName().equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown bracket side: " + value));
    }
}
