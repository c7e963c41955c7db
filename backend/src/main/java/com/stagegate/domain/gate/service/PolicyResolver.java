package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicy;
import com.stagegate.domain.gate.model.GatePolicyOverride;
import com.stagegate.domain.gate.repository.GatePolicyOverrideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the effective {@link GatePolicy} for a tenant: stored overrides win field by field,
 * everything else comes from {@link DefaultGatePolicies}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyResolver {

    private final GatePolicyOverrideRepository overrideRepository;
    private final DefaultGatePolicies defaultPolicies;

    /**
     * Resolve by gate name. An unknown name degrades to the least-restrictive default
     * instead of failing the evaluation.
     */
    public GatePolicy resolve(String tenantId, String gateName) {
        Optional<GateId> gate = GateId.fromName(gateName);
        if (gate.isEmpty()) {
            log.warn("[Policy] Unknown gate '{}' for tenant={}, falling back to least-restrictive default",
                    gateName, tenantId);
            return defaultPolicies.leastRestrictive();
        }
        return resolve(tenantId, gate.get());
    }

    public GatePolicy resolve(String tenantId, GateId gate) {
        GatePolicy defaults = defaultPolicies.get(gate);
        return overrideRepository.findByTenantIdAndGate(tenantId, gate)
                .map(override -> {
                    log.debug("[Policy] Applying custom {} policy for tenant={}", gate, tenantId);
                    return merge(defaults, override);
                })
                .orElse(defaults);
    }

    public boolean hasOverride(String tenantId, GateId gate) {
        return overrideRepository.findByTenantIdAndGate(tenantId, gate).isPresent();
    }

    static GatePolicy merge(GatePolicy defaults, GatePolicyOverride override) {
        return defaults.toBuilder()
                .minExperiments(orDefault(override.getMinExperiments(), defaults.minExperiments()))
                .minWeakEvidence(orDefault(override.getMinWeakEvidence(), defaults.minWeakEvidence()))
                .minMediumEvidence(orDefault(override.getMinMediumEvidence(), defaults.minMediumEvidence()))
                .minStrongEvidence(orDefault(override.getMinStrongEvidence(), defaults.minStrongEvidence()))
                .minTotalEvidence(orDefault(override.getMinTotalEvidence(), defaults.minTotalEvidence()))
                .minQuality(orDefault(override.getMinQuality(), defaults.minQuality()))
                .thresholds(orDefault(override.getThresholds(), defaults.thresholds()))
                .requiresApproval(orDefault(override.getRequiresApproval(), defaults.requiresApproval()))
                .requiredEvidenceTypes(override.getRequiredEvidenceTypes() != null
                        ? toTypes(override.getRequiredEvidenceTypes())
                        : defaults.requiredEvidenceTypes())
                .build();
    }

    private static Set<EvidenceType> toTypes(Iterable<String> codes) {
        Set<EvidenceType> types = EnumSet.noneOf(EvidenceType.class);
        for (String code : codes) {
            EvidenceType type = EvidenceType.fromCode(code);
            if (type != null) {
                types.add(type);
            } else {
                log.warn("[Policy] Ignoring unknown evidence type '{}' in policy override", code);
            }
        }
        return Set.copyOf(types);
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
