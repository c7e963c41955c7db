package com.stagegate.domain.onboarding.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityAssessmentTest {

    @Test
    @DisplayName("null topics are dropped")
    void nullTopicsDropped() {
        QualityAssessment assessment = QualityAssessment.of(Arrays.asList("practice_name", null), 0.5);

        assertThat(assessment.topicsCovered()).containsExactly("practice_name");
    }

    @Test
    @DisplayName("null insights and next steps are dropped")
    void nullSummaryEntriesDropped() {
        QualityAssessment assessment = new QualityAssessment(List.of(), 1.0, Clarity.HIGH, Completeness.COMPLETE,
                null, null, Arrays.asList(null, "Clients want fixed fees"), Arrays.asList("Run a pricing test", null));

        assertThat(assessment.keyInsights()).containsExactly("Clients want fixed fees");
        assertThat(assessment.recommendedNextSteps()).containsExactly("Run a pricing test");
        assertThat(assessment.extractedData()).isEmpty();
    }

    @Test
    @DisplayName("missing lists become empty")
    void missingListsEmpty() {
        QualityAssessment assessment = QualityAssessment.of(null, 0.0);

        assertThat(assessment.topicsCovered()).isEmpty();
        assertThat(assessment.keyInsights()).isEmpty();
    }
}
