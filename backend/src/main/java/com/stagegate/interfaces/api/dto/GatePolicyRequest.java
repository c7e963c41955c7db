package com.stagegate.interfaces.api.dto;

import com.stagegate.application.gate.GatePolicyCommand;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.Map;

public record GatePolicyRequest(
        @PositiveOrZero(message = "minExperiments must not be negative")
        Integer minExperiments,

        @PositiveOrZero(message = "minWeakEvidence must not be negative")
        Integer minWeakEvidence,

        @PositiveOrZero(message = "minMediumEvidence must not be negative")
        Integer minMediumEvidence,

        @PositiveOrZero(message = "minStrongEvidence must not be negative")
        Integer minStrongEvidence,

        @PositiveOrZero(message = "minTotalEvidence must not be negative")
        Integer minTotalEvidence,

        @DecimalMin(value = "0.0", message = "minQuality must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "minQuality must be between 0 and 1")
        Double minQuality,

        Map<String, Double> thresholds,

        Boolean requiresApproval,

        List<String> requiredEvidenceTypes
) {
    public GatePolicyCommand toCommand() {
        return new GatePolicyCommand(minExperiments, minWeakEvidence, minMediumEvidence, minStrongEvidence,
                minTotalEvidence, minQuality, thresholds, requiresApproval, requiredEvidenceTypes);
    }
}
