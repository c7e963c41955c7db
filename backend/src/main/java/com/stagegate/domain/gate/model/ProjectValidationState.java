package com.stagegate.domain.gate.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Per-project gate progress. Created all-zero and PENDING; afterwards mutated only
 * with the output of an evaluation or an explicit gate advance.
 */
@Entity
@Table(name = "project_validation_states")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProjectValidationState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, unique = true, length = 64)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GateId stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private GateStatus gateStatus;

    @Column(nullable = false)
    private double evidenceQuality;

    @Column(nullable = false)
    private int experimentsCount;

    @Column(nullable = false)
    private int evidenceCount;

    @Column(nullable = false)
    private int hypothesesCount;

    @Column(nullable = false)
    private double readinessScore;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Builder
    public ProjectValidationState(String tenantId, String projectId, GateId stage, GateStatus gateStatus,
                                  double evidenceQuality, int experimentsCount, int evidenceCount,
                                  int hypothesesCount) {
        this.tenantId = tenantId;
        this.projectId = projectId;
        this.stage = stage != null ? stage : GateId.DESIRABILITY;
        this.gateStatus = gateStatus != null ? gateStatus : GateStatus.PENDING;
        this.evidenceQuality = evidenceQuality;
        this.experimentsCount = experimentsCount;
        this.evidenceCount = evidenceCount;
        this.hypothesesCount = hypothesesCount;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public static ProjectValidationState create(String tenantId, String projectId) {
        return ProjectValidationState.builder()
                .tenantId(tenantId)
                .projectId(projectId)
                .build();
    }

    /**
     * True while none of the gate criteria has been measured.
     */
    public boolean isUnmeasured() {
        return evidenceQuality == 0.0 && experimentsCount == 0 && evidenceCount == 0;
    }

    public void applyMetrics(EvidenceSummary summary) {
        this.evidenceQuality = summary.averageQuality();
        this.experimentsCount = summary.experimentCount();
        this.evidenceCount = summary.evidenceCount();
        touch();
    }

    public void updateHypothesesCount(int hypothesesCount) {
        this.hypothesesCount = Math.max(0, hypothesesCount);
        touch();
    }

    public void applyEvaluation(GateEvaluation evaluation) {
        if (evaluation.gate() != stage) {
            throw new IllegalArgumentException(
                    "Evaluation for " + evaluation.gate() + " cannot be applied to a project at " + stage);
        }
        this.gateStatus = evaluation.status();
        this.readinessScore = evaluation.readinessScore();
        touch();
    }

    /**
     * Moves to the given gate. The new gate starts PENDING with no readiness until it is evaluated.
     */
    public void advanceTo(GateId next) {
        this.stage = next;
        this.gateStatus = GateStatus.PENDING;
        this.readinessScore = 0.0;
        touch();
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
