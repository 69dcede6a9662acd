package com.dexarena.tournament.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ByeRequest(
    @JsonProperty("participant") @NotBlank String participant
) {}
