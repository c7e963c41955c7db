package com.stagegate.interfaces.api.dto;

import com.stagegate.application.gate.GatePolicyView;
import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicy;

import java.util.List;
import java.util.Map;

public record GatePolicyResponse(
        GateId gate,
        int minExperiments,
        int minWeakEvidence,
        int minMediumEvidence,
        int minStrongEvidence,
        int minTotalEvidence,
        double minQuality,
        Map<String, Double> thresholds,
        boolean requiresApproval,
        List<String> requiredEvidenceTypes,
        boolean custom
) {
    public static GatePolicyResponse from(GatePolicyView view) {
        GatePolicy p = view.policy();
        return new GatePolicyResponse(p.gate(), p.minExperiments(), p.minWeakEvidence(), p.minMediumEvidence(),
                p.minStrongEvidence(), p.minTotalEvidence(), p.minQuality(), p.thresholds(), p.requiresApproval(),
                p.requiredEvidenceTypes().stream().map(EvidenceType::code).sorted().toList(),
                view.custom());
    }
}
