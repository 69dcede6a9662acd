package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A competitor paired with its score, as produced by tie-break ordering.
 */
public record ScoredCompetitor(
    @JsonProperty("participant") CompetitorId participant,
    @JsonProperty("score") int score
) {}
