package com.stagegate.application.gate;

import com.stagegate.domain.gate.model.GatePolicy;

/**
 * @param custom true when a tenant override contributes to the policy
 */
public record GatePolicyView(GatePolicy policy, boolean custom) {
}
