package com.stagegate.interfaces.api.dto;

import com.stagegate.domain.onboarding.model.OnboardingFlow;
import com.stagegate.domain.onboarding.model.OnboardingSession;
import com.stagegate.domain.onboarding.model.SessionStatus;

import java.time.LocalDateTime;
import java.util.Map;

public record SessionResponse(
        String sessionId,
        OnboardingFlow flow,
        int stageNumber,
        String stageName,
        int messageCount,
        Map<String, Object> collectedData,
        SessionStatus status,
        int progressPercent,
        Long version,
        LocalDateTime completedAt
) {
    public static SessionResponse from(OnboardingSession session, String stageName) {
        return new SessionResponse(
                session.getSessionId(),
                session.getFlow(),
                session.getStageNumber(),
                stageName,
                session.getMessageCount(),
                session.getCollectedData(),
                session.getStatus(),
                session.getProgressPercent(),
                session.getVersion(),
                session.getCompletedAt());
    }
}
