package com.stagegate.application.gate;

import com.stagegate.domain.gate.model.EvidenceSummary;
import com.stagegate.domain.gate.model.GateEvaluation;
import com.stagegate.domain.gate.model.ProjectValidationState;

/**
 * Outcome of evaluating a project against its current gate.
 *
 * @param readinessAlert message when the project is close to passing, otherwise null
 */
public record GateCheckResult(
        ProjectValidationState state,
        GateEvaluation evaluation,
        EvidenceSummary summary,
        String readinessAlert
) {
    public boolean hasReadinessAlert() {
        return readinessAlert != null;
    }
}
