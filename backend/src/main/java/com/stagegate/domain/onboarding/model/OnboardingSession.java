package com.stagegate.domain.onboarding.model;

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
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Progress of one onboarding conversation.
 */
@Entity
@Table(name = "onboarding_sessions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OnboardingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String sessionId;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OnboardingFlow flow;

    @Column(nullable = false)
    private int stageNumber;

    @Column(nullable = false)
    private int messageCount;

    @Column(nullable = false)
    private int stageMessageCount;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> collectedData = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SessionStatus status;

    @Column(nullable = false)
    private int progressPercent;

    @Column(length = 64)
    private String lastAssessmentKey;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    public OnboardingSession(String sessionId, String tenantId, OnboardingFlow flow) {
        this.sessionId = sessionId;
        this.tenantId = tenantId;
        this.flow = flow;
        this.stageNumber = 1;
        this.status = SessionStatus.ACTIVE;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public static OnboardingSession start(String tenantId, OnboardingFlow flow) {
        return new OnboardingSession(UUID.randomUUID().toString(), tenantId, flow);
    }

    public Map<String, Object> getCollectedData() {
        return collectedData == null ? Map.of() : Collections.unmodifiableMap(collectedData);
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }

    public void recordMessages(int count) {
        this.messageCount += count;
        this.stageMessageCount += count;
        touch();
    }

    public void replaceCollectedData(Map<String, Object> data) {
        this.collectedData = new LinkedHashMap<>(data);
        touch();
    }

    /**
     * Moves to the next stage and restarts the per-stage message count.
     */
    public void advanceStage() {
        this.stageNumber++;
        this.stageMessageCount = 0;
        touch();
    }

    public void updateProgress(int progressPercent) {
        this.progressPercent = progressPercent;
        touch();
    }

    public void markAssessed(String assessmentKey) {
        this.lastAssessmentKey = assessmentKey;
        touch();
    }

    public void complete() {
        this.status = SessionStatus.COMPLETED;
        this.progressPercent = 100;
        this.completedAt = LocalDateTime.now();
        touch();
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
