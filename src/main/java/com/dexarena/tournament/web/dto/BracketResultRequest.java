package com.dexarena.tournament.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record BracketResultRequest(
    @JsonProperty("winner") @NotBlank String winner
) {}
