package com.dexarena.tournament.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * DTO for simulation requests. Without {@code playoff} only the Swiss phase is played;
 * {@code stats} feeds the higher-stat decider.
 */
public record SimulationRequest(
    @JsonProperty("participants") @NotEmpty List<@NotBlank String> participants,
    @JsonProperty("owner") @NotBlank String owner,
    @JsonProperty("decider") @NotBlank String decider,
    @JsonProperty("playoff") String playoff,
    @JsonProperty("cutoff") @Min(2) Integer cutoff,
    @JsonProperty("stats") Map<String, Integer> stats
) {}
