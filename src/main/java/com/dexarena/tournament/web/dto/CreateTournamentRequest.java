package com.dexarena.tournament.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * DTO for tournament creation requests.
 */
public record CreateTournamentRequest(
    @JsonProperty("participants") @NotEmpty List<@NotBlank String> participants,
    @JsonProperty("owner") @NotBlank String owner
) {}
