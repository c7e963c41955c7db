package com.stagegate.interfaces.api.dto;

import com.stagegate.domain.onboarding.model.OnboardingFlow;
import jakarta.validation.constraints.NotNull;

public record StartSessionRequest(
        @NotNull(message = "flow is required")
        OnboardingFlow flow
) {}
