package com.stagegate.application.gate;

import java.util.List;
import java.util.Map;

/**
 * Override values for one gate. Null fields keep the built-in default.
 */
public record GatePolicyCommand(
        Integer minExperiments,
        Integer minWeakEvidence,
        Integer minMediumEvidence,
        Integer minStrongEvidence,
        Integer minTotalEvidence,
        Double minQuality,
        Map<String, Double> thresholds,
        Boolean requiresApproval,
        List<String> requiredEvidenceTypes
) {
}
