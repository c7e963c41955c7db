package com.stagegate.domain.onboarding.model;

public record StageTopic(String key, String label) {
}
