package com.stagegate.domain.gate.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Tenant-specific gate policy customization. Null columns fall back to the built-in default.
 */
@Entity
@Table(name = "gate_policy_overrides",
        uniqueConstraints = @UniqueConstraint(columnNames = {"tenantId", "gate"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GatePolicyOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GateId gate;

    private Integer minExperiments;

    private Integer minWeakEvidence;

    private Integer minMediumEvidence;

    private Integer minStrongEvidence;

    private Integer minTotalEvidence;

    private Double minQuality;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Double> thresholds;

    private Boolean requiresApproval;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> requiredEvidenceTypes;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public GatePolicyOverride(String tenantId, GateId gate) {
        this.tenantId = tenantId;
        this.gate = gate;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Replaces every overridable value. Nulls clear the override for that field.
     */
    public void update(Integer minExperiments, Integer minWeakEvidence, Integer minMediumEvidence,
                       Integer minStrongEvidence, Integer minTotalEvidence, Double minQuality,
                       Map<String, Double> thresholds, Boolean requiresApproval,
                       List<String> requiredEvidenceTypes) {
        this.minExperiments = minExperiments;
        this.minWeakEvidence = minWeakEvidence;
        this.minMediumEvidence = minMediumEvidence;
        this.minStrongEvidence = minStrongEvidence;
        this.minTotalEvidence = minTotalEvidence;
        this.minQuality = minQuality;
        this.thresholds = thresholds;
        this.requiresApproval = requiresApproval;
        this.requiredEvidenceTypes = requiredEvidenceTypes;
        this.updatedAt = LocalDateTime.now();
    }
}
