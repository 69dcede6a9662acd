package com.dexarena.tournament.format;

import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum PlayoffType {
    SINGLE_ELIMINATION("single-elimination"),
    DOUBLE_ELIMINATION("double-elimination");

    private final String configName;

    PlayoffType(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    @JsonCreator
    public static PlayoffType fromConfigName(String value) {
        return Arrays.stream(values())
            .filter(type -> type.configName.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidTournamentInputException("Unsupported playoff '" + value + "'"));
    }
}
