package com.stagegate.domain.onboarding.repository;

import com.stagegate.domain.onboarding.model.OnboardingSession;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OnboardingSessionRepository extends JpaRepository<OnboardingSession, Long> {

    Optional<OnboardingSession> findBySessionIdAndTenantId(String sessionId, String tenantId);
}
