package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultGatePoliciesTest {

    private DefaultGatePolicies defaults;

    @BeforeEach
    void setUp() {
        defaults = new DefaultGatePolicies();
    }

    @Test
    @DisplayName("every gate has a policy")
    void everyGateCovered() {
        for (GateId gate : GateId.values()) {
            assertThat(defaults.get(gate)).isNotNull();
            assertThat(defaults.get(gate).gate()).isEqualTo(gate);
        }
    }

    @Test
    @DisplayName("later gates are never weaker on experiments, quality or total evidence")
    void monotonicAcrossGates() {
        GateId[] gates = GateId.values();
        for (int i = 1; i < gates.length; i++) {
            GatePolicy earlier = defaults.get(gates[i - 1]);
            GatePolicy later = defaults.get(gates[i]);

            assertThat(later.minExperiments()).isGreaterThanOrEqualTo(earlier.minExperiments());
            assertThat(later.minQuality()).isGreaterThanOrEqualTo(earlier.minQuality());
            assertThat(later.minTotalEvidence()).isGreaterThanOrEqualTo(earlier.minTotalEvidence());
        }
    }

    @Test
    @DisplayName("desirability defaults")
    void desirability() {
        GatePolicy policy = defaults.get(GateId.DESIRABILITY);

        assertThat(policy.minExperiments()).isEqualTo(5);
        assertThat(policy.minTotalEvidence()).isEqualTo(10);
        assertThat(policy.minQuality()).isEqualTo(0.70);
        assertThat(policy.thresholds()).containsEntry("fit_score", 70.0).containsEntry("ctr", 0.02);
        assertThat(policy.requiredEvidenceTypes()).containsExactlyInAnyOrder(EvidenceType.INTERVIEW, EvidenceType.ANALYTICS);
    }

    @Test
    @DisplayName("least restrictive fallback is the desirability policy")
    void leastRestrictive() {
        assertThat(defaults.leastRestrictive()).isEqualTo(defaults.get(GateId.DESIRABILITY));
    }

    @Test
    @DisplayName("quality minimums stay within [0,1]")
    void qualityRange() {
        for (GateId gate : GateId.values()) {
            assertThat(defaults.get(gate).minQuality()).isBetween(0.0, 1.0);
        }
    }
}
