package com.stagegate.domain.gate.repository;

import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicyOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GatePolicyOverrideRepository extends JpaRepository<GatePolicyOverride, Long> {

    Optional<GatePolicyOverride> findByTenantIdAndGate(String tenantId, GateId gate);

    void deleteByTenantIdAndGate(String tenantId, GateId gate);
}
