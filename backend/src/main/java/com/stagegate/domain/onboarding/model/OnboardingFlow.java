package com.stagegate.domain.onboarding.model;

/**
 * Which conversation script a session follows. Each flow has its own 7-stage catalog.
 */
public enum OnboardingFlow {
    FOUNDER,
    CONSULTANT
}
