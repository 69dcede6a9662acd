package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of one participant's qualification record.
 */
public record Standing(
    @JsonProperty("participant") CompetitorId participant,
    @JsonProperty("score") int score,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("draws") int draws
) {}
