package com.ryvin.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposeMeetingRequest(
    @NotNull(message = "proposed_time is required") Instant proposedTime,
    @NotBlank(message = "location is required")
        @Size(max = 200, message = "location must be at most 200 characters")
        String location) {}
