package com.stagegate.interfaces.api.dto;

import com.stagegate.domain.gate.model.EvidenceStrength;
import com.stagegate.domain.gate.model.EvidenceType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

public record EvidenceRequest(
        EvidenceType type,

        EvidenceStrength strength,

        @DecimalMin(value = "0.0", message = "qualityScore must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "qualityScore must be between 0 and 1")
        Double qualityScore,

        boolean contradiction,

        @Size(max = 500, message = "summary must be at most 500 characters")
        String summary
) {}
