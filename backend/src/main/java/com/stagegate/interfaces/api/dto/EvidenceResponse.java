package com.stagegate.interfaces.api.dto;

import com.stagegate.domain.gate.model.EvidenceRecord;

import java.time.LocalDateTime;

public record EvidenceResponse(
        Long id,
        String projectId,
        String type,
        String strength,
        Double qualityScore,
        boolean contradiction,
        String summary,
        LocalDateTime recordedAt
) {
    public static EvidenceResponse from(EvidenceRecord record) {
        return new EvidenceResponse(
                record.getId(),
                record.getProjectId(),
                record.getType() != null ? record.getType().code() : null,
                record.getStrength() != null ? record.getStrength().code() : null,
                record.getQualityScore(),
                record.isContradiction(),
                record.getSummary(),
                record.getRecordedAt());
    }
}
