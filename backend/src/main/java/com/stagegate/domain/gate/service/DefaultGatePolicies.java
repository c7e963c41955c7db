package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicy;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Built-in gate policies. Each later gate is at least as strict as the one before it
 * on experiments, quality and total evidence.
 */
@Component
public class DefaultGatePolicies {

    private final Map<GateId, GatePolicy> policies = new EnumMap<>(GateId.class);

    public DefaultGatePolicies() {
        register(GatePolicy.builder()
                .gate(GateId.DESIRABILITY)
                .minExperiments(5)
                .minWeakEvidence(0)
                .minMediumEvidence(1)
                .minStrongEvidence(1)
                .minTotalEvidence(10)
                .minQuality(0.70)
                .thresholds(Map.of("fit_score", 70.0, "ctr", 0.02))
                .requiresApproval(true)
                .requiredEvidenceTypes(Set.of(EvidenceType.INTERVIEW, EvidenceType.ANALYTICS))
                .build());

        register(GatePolicy.builder()
                .gate(GateId.FEASIBILITY)
                .minExperiments(8)
                .minWeakEvidence(0)
                .minMediumEvidence(1)
                .minStrongEvidence(2)
                .minTotalEvidence(15)
                .minQuality(0.75)
                .thresholds(Map.of("fit_score", 75.0))
                .requiresApproval(true)
                .requiredEvidenceTypes(Set.of(EvidenceType.EXPERIMENT, EvidenceType.ANALYTICS))
                .build());

        register(GatePolicy.builder()
                .gate(GateId.VIABILITY)
                .minExperiments(10)
                .minWeakEvidence(0)
                .minMediumEvidence(2)
                .minStrongEvidence(3)
                .minTotalEvidence(20)
                .minQuality(0.80)
                .thresholds(Map.of("fit_score", 80.0, "conversion_rate", 0.05))
                .requiresApproval(true)
                .requiredEvidenceTypes(Set.of(EvidenceType.EXPERIMENT, EvidenceType.ANALYTICS))
                .build());

        register(GatePolicy.builder()
                .gate(GateId.SCALE)
                .minExperiments(15)
                .minWeakEvidence(0)
                .minMediumEvidence(3)
                .minStrongEvidence(5)
                .minTotalEvidence(30)
                .minQuality(0.85)
                .thresholds(Map.of("fit_score", 85.0))
                .requiresApproval(true)
                .requiredEvidenceTypes(Set.of(EvidenceType.EXPERIMENT, EvidenceType.ANALYTICS, EvidenceType.INTERVIEW))
                .build());
    }

    public GatePolicy get(GateId gate) {
        return policies.get(gate);
    }

    /**
     * Fallback used when a gate identifier cannot be resolved.
     */
    public GatePolicy leastRestrictive() {
        return policies.get(GateId.DESIRABILITY);
    }

    private void register(GatePolicy policy) {
        policies.put(policy.gate(), policy);
    }
}
