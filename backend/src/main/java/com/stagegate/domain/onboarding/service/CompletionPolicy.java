package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.Completeness;
import com.stagegate.domain.onboarding.model.QualityAssessment;
import org.springframework.stereotype.Component;

/**
 * Whether a final-stage conversation has produced what completion needs: a "complete" verdict
 * plus at least three key insights and three recommended next steps.
 * Only an explicit complete action acts on this; turns never complete a session by themselves.
 */
@Component
public class CompletionPolicy {

    static final int MIN_SUMMARY_ITEMS = 3;

    public boolean isReadyToComplete(QualityAssessment assessment, int currentStage) {
        if (assessment == null || currentStage != StageCatalog.TOTAL_STAGES) {
            return false;
        }
        return assessment.completeness() == Completeness.COMPLETE
                && assessment.keyInsights().size() >= MIN_SUMMARY_ITEMS
                && assessment.recommendedNextSteps().size() >= MIN_SUMMARY_ITEMS;
    }
}
