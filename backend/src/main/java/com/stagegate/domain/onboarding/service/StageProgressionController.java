package com.stagegate.domain.onboarding.service;

import com.stagegate.domain.onboarding.model.QualityAssessment;
import com.stagegate.domain.onboarding.model.StageConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;

/**
 * Decides whether an onboarding conversation moves to its next topic stage.
 *
 * <p>Advance conditions (OR), never from the final stage or an out-of-range stage:
 * <ol>
 *   <li>distinct topics covered / topics required &ge; topic threshold (0.75)</li>
 *   <li>message count given, &ge; 6 messages in the stage AND coverage &ge; 0.6</li>
 * </ol>
 */
@Slf4j
@Component
public class StageProgressionController {

    public static final int FINAL_STAGE = StageCatalog.TOTAL_STAGES;

    private final double topicThreshold;
    private final int fallbackMinMessages;
    private final double fallbackMinCoverage;

    public StageProgressionController() {
        this(0.75, 6, 0.6);
    }

    @Autowired
    public StageProgressionController(
            @Value("${gating.stage.topic-threshold:0.75}") double topicThreshold,
            @Value("${gating.stage.fallback-min-messages:6}") int fallbackMinMessages,
            @Value("${gating.stage.fallback-min-coverage:0.6}") double fallbackMinCoverage) {
        this.topicThreshold = topicThreshold;
        this.fallbackMinMessages = fallbackMinMessages;
        this.fallbackMinCoverage = fallbackMinCoverage;
    }

    public boolean shouldAdvance(QualityAssessment assessment, StageConfig stage, Integer messageCount) {
        return shouldAdvance(assessment, stage.stageNumber(), messageCount, stage.topicCount());
    }

    public boolean shouldAdvance(QualityAssessment assessment, int currentStage, int topicsRequiredForStage) {
        return shouldAdvance(assessment, currentStage, null, topicsRequiredForStage);
    }

    /**
     * @param messageCount           messages exchanged in the current stage; null disables the fallback rule
     * @param topicsRequiredForStage number of topics the stage collects; when not positive the
     *                               assessment's own coverage is used for the topic rule
     */
    public boolean shouldAdvance(QualityAssessment assessment, int currentStage, Integer messageCount,
                                 int topicsRequiredForStage) {
        if (assessment == null || currentStage < 1 || currentStage >= FINAL_STAGE) {
            return false;
        }

        double topicRatio = topicsRequiredForStage > 0
                ? (double) new HashSet<>(assessment.topicsCovered()).size() / topicsRequiredForStage
                : assessment.coverage();
        if (topicRatio >= topicThreshold) {
            log.info("[Gating] StageAdvance: ON (stage={}, topicRatio={})",
                    currentStage, String.format(Locale.ROOT, "%.2f", topicRatio));
            return true;
        }

        if (messageCount != null && messageCount >= fallbackMinMessages
                && assessment.coverage() >= fallbackMinCoverage) {
            log.info("[Gating] StageAdvance: ON (message fallback: stage={}, messages={}, coverage={})",
                    currentStage, messageCount, assessment.coverage());
            return true;
        }

        return false;
    }

    /**
     * Coverage-driven completion check at the final stage.
     *
     * <p>Because {@link #shouldAdvance} never advances from the final stage, this is false for every
     * input. Completion is decided by {@link CompletionPolicy} and applied through an explicit action.
     */
    public boolean isComplete(QualityAssessment assessment, int currentStage) {
        if (currentStage != FINAL_STAGE) {
            return false;
        }
        return shouldAdvance(assessment, currentStage, null, 0);
    }
}
