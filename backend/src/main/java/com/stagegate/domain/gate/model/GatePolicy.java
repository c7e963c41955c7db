package com.stagegate.domain.gate.model;

import lombok.Builder;

import java.util.Map;
import java.util.Set;

/**
 * Thresholds a project's evidence must meet to pass a gate.
 *
 * @param gate                  gate this policy applies to
 * @param minExperiments        minimum number of experiment-type evidence items
 * @param minWeakEvidence       advisory minimum of weak-strength items
 * @param minMediumEvidence     advisory minimum of medium-strength items
 * @param minStrongEvidence     advisory minimum of strong-strength items
 * @param minTotalEvidence      minimum evidence count
 * @param minQuality            minimum average evidence quality in [0,1]
 * @param thresholds            free-form metric thresholds (e.g. fit_score, ctr), carried for downstream consumers
 * @param requiresApproval      whether passing still requires a human approval step
 * @param requiredEvidenceTypes advisory set of evidence types expected before passing
 */
@Builder(toBuilder = true)
public record GatePolicy(
        GateId gate,
        int minExperiments,
        int minWeakEvidence,
        int minMediumEvidence,
        int minStrongEvidence,
        int minTotalEvidence,
        double minQuality,
        Map<String, Double> thresholds,
        boolean requiresApproval,
        Set<EvidenceType> requiredEvidenceTypes
) {
    public GatePolicy {
        thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
        requiredEvidenceTypes = requiredEvidenceTypes == null ? Set.of() : Set.copyOf(requiredEvidenceTypes);
    }

    public int minStrength(EvidenceStrength strength) {
        return switch (strength) {
            case WEAK -> minWeakEvidence;
            case MEDIUM -> minMediumEvidence;
            case STRONG -> minStrongEvidence;
        };
    }
}
