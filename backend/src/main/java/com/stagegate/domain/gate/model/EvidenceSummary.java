package com.stagegate.domain.gate.model;

import java.util.Map;
import java.util.Set;

/**
 * Aggregated view of a project's evidence list.
 */
public record EvidenceSummary(
        int evidenceCount,
        int experimentCount,
        double averageQuality,
        Map<EvidenceStrength, Integer> strengthMix,
        Set<EvidenceType> evidenceTypes,
        int contradictionCount
) {
    public int strengthCount(EvidenceStrength strength) {
        return strengthMix.getOrDefault(strength, 0);
    }
}
