package com.stagegate.domain.onboarding.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
