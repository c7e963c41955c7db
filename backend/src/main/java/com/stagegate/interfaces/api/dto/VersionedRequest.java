package com.stagegate.interfaces.api.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record VersionedRequest(
        @PositiveOrZero(message = "expectedVersion must not be negative")
        Long expectedVersion
) {}
