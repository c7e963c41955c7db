package com.stagegate.domain.gate.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored evidence row. Immutable once recorded.
 */
@Entity
@Table(name = "evidence_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EvidenceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private EvidenceType type;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private EvidenceStrength strength;

    private Double qualityScore;

    @Column(nullable = false)
    private boolean contradiction;

    @Column(length = 500)
    private String summary;

    @Column(nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @Builder
    public EvidenceRecord(String projectId, EvidenceType type, EvidenceStrength strength,
                          Double qualityScore, boolean contradiction, String summary) {
        this.projectId = projectId;
        this.type = type;
        this.strength = strength;
        this.qualityScore = qualityScore;
        this.contradiction = contradiction;
        this.summary = summary;
        this.recordedAt = LocalDateTime.now();
    }

    public EvidenceItem toItem() {
        return new EvidenceItem(type, strength, qualityScore, contradiction);
    }
}
