package com.stagegate.domain.onboarding.model;

public enum Clarity {
    LOW,
    MEDIUM,
    HIGH
}
