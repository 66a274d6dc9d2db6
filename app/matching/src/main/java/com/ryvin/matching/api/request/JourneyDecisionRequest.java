package com.ryvin.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JourneyDecisionRequest(
    @NotBlank(message = "decision is required") String decision,
    @Size(max = 200, message = "reason must be at most 200 characters") String reason) {}
