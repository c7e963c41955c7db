package com.stagegate.interfaces.api.dto;

import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GateStatus;
import com.stagegate.domain.gate.model.ProjectValidationState;

import java.time.LocalDateTime;

public record ValidationStateResponse(
        String projectId,
        GateId stage,
        GateStatus gateStatus,
        double evidenceQuality,
        int experimentsCount,
        int evidenceCount,
        int hypothesesCount,
        double readinessScore,
        Long version,
        LocalDateTime updatedAt
) {
    public static ValidationStateResponse from(ProjectValidationState state) {
        return new ValidationStateResponse(
                state.getProjectId(),
                state.getStage(),
                state.getGateStatus(),
                state.getEvidenceQuality(),
                state.getExperimentsCount(),
                state.getEvidenceCount(),
                state.getHypothesesCount(),
                state.getReadinessScore(),
                state.getVersion(),
                state.getUpdatedAt());
    }
}
