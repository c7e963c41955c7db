package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.Clarity;
import com.stagegate.domain.onboarding.model.Completeness;
import com.stagegate.domain.onboarding.model.QualityAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionPolicyTest {

    private CompletionPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new CompletionPolicy();
    }

    private QualityAssessment summary(Completeness completeness, int insights, int nextSteps) {
        return new QualityAssessment(List.of("goals"), 1.0, Clarity.HIGH, completeness, null, Map.of(),
                List.of("i1", "i2", "i3", "i4").subList(0, insights),
                List.of("s1", "s2", "s3", "s4").subList(0, nextSteps));
    }

    @Test
    @DisplayName("complete verdict with 3 insights and 3 next steps at stage 7 → ready")
    void ready() {
        assertThat(policy.isReadyToComplete(summary(Completeness.COMPLETE, 3, 3), 7)).isTrue();
    }

    @Test
    @DisplayName("not on the final stage → not ready")
    void earlierStage() {
        assertThat(policy.isReadyToComplete(summary(Completeness.COMPLETE, 4, 4), 6)).isFalse();
    }

    @Test
    @DisplayName("partial verdict → not ready")
    void partial() {
        assertThat(policy.isReadyToComplete(summary(Completeness.PARTIAL, 3, 3), 7)).isFalse();
    }

    @Test
    @DisplayName("too few insights or next steps → not ready")
    void tooFewItems() {
        assertThat(policy.isReadyToComplete(summary(Completeness.COMPLETE, 2, 3), 7)).isFalse();
        assertThat(policy.isReadyToComplete(summary(Completeness.COMPLETE, 3, 2), 7)).isFalse();
    }

    @Test
    @DisplayName("null assessment → not ready")
    void nullAssessment() {
        assertThat(policy.isReadyToComplete(null, 7)).isFalse();
    }
}
