package com.dexarena.tournament.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * DTO for a qualification result. {@code winner} is omitted for draws.
 */
public record MatchResultRequest(
    @JsonProperty("participant1") @NotBlank String participant1,
    @JsonProperty("participant2") @NotBlank String participant2,
    @JsonProperty("outcome") @NotBlank String outcome,
    @JsonProperty("winner") String winner
) {}
