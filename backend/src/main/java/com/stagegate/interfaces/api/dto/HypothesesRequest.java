package com.stagegate.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record HypothesesRequest(
        @NotNull(message = "hypothesesCount is required")
        @PositiveOrZero(message = "hypothesesCount must not be negative")
        Integer hypothesesCount,

        @PositiveOrZero(message = "expectedVersion must not be negative")
        Long expectedVersion
) {}
