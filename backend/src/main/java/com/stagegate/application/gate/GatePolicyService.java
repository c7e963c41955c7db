package com.stagegate.application.gate;

import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicyOverride;
import com.stagegate.domain.gate.repository.GatePolicyOverrideRepository;
import com.stagegate.domain.gate.service.PolicyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GatePolicyService {

    private final GatePolicyOverrideRepository overrideRepository;
    private final PolicyResolver policyResolver;

    @Transactional(readOnly = true)
    public GatePolicyView get(String tenantId, String gateName) {
        GateId gate = parseGate(gateName);
        return new GatePolicyView(policyResolver.resolve(tenantId, gate), policyResolver.hasOverride(tenantId, gate));
    }

    @Transactional
    public GatePolicyView upsert(String tenantId, String gateName, GatePolicyCommand command) {
        GateId gate = parseGate(gateName);
        List<String> types = normalizeTypes(command.requiredEvidenceTypes());

        GatePolicyOverride override = overrideRepository.findByTenantIdAndGate(tenantId, gate)
                .orElseGet(() -> new GatePolicyOverride(tenantId, gate));
        override.update(command.minExperiments(), command.minWeakEvidence(), command.minMediumEvidence(),
                command.minStrongEvidence(), command.minTotalEvidence(), command.minQuality(),
                command.thresholds(), command.requiresApproval(), types);
        overrideRepository.save(override);

        log.info("[Policy] Override saved for tenant={} gate={}", tenantId, gate);
        return new GatePolicyView(policyResolver.resolve(tenantId, gate), true);
    }

    @Transactional
    public GatePolicyView reset(String tenantId, String gateName) {
        GateId gate = parseGate(gateName);
        overrideRepository.deleteByTenantIdAndGate(tenantId, gate);
        log.info("[Policy] Override removed for tenant={} gate={}", tenantId, gate);
        return new GatePolicyView(policyResolver.resolve(tenantId, gate), false);
    }

    private GateId parseGate(String gateName) {
        return GateId.fromName(gateName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown gate: " + gateName));
    }

    private List<String> normalizeTypes(List<String> codes) {
        if (codes == null) {
            return null;
        }
        return codes.stream()
                .map(code -> {
                    EvidenceType type = EvidenceType.fromCode(code);
                    if (type == null) {
                        throw new IllegalArgumentException("Unknown evidence type: " + code);
                    }
                    return type.code();
                })
                .distinct()
                .toList();
    }
}
