package com.stagegate.domain.onboarding.model;

public enum Completeness {
    INSUFFICIENT,
    PARTIAL,
    COMPLETE
}
