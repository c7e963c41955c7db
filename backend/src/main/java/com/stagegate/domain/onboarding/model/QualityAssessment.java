package com.stagegate.domain.onboarding.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-turn assessment produced by the external quality-assessment collaborator.
 * Consumed as-is; never mutated.
 *
 * @param topicsCovered        data keys the user engaged with this stage, "I don't know" included
 * @param coverage             fraction of the stage's topics covered, in [0,1]
 * @param clarity              how specific the answers were
 * @param completeness         the assessor's own readiness verdict
 * @param notes                free-text observations (nullable)
 * @param extractedData        extracted values by key; null values are allowed and mean "nothing extracted"
 * @param keyInsights          stage-7 summary insights
 * @param recommendedNextSteps stage-7 suggested experiments
 */
public record QualityAssessment(
        List<String> topicsCovered,
        double coverage,
        Clarity clarity,
        Completeness completeness,
        String notes,
        Map<String, ExtractedValue> extractedData,
        List<String> keyInsights,
        List<String> recommendedNextSteps
) {
    public QualityAssessment {
        topicsCovered = present(topicsCovered);
        extractedData = extractedData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
        keyInsights = present(keyInsights);
        recommendedNextSteps = present(recommendedNextSteps);
    }

    // null entries from the upstream assessor carry nothing and are dropped
    private static List<String> present(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public static QualityAssessment of(List<String> topicsCovered, double coverage) {
        return new QualityAssessment(topicsCovered, coverage, Clarity.MEDIUM, Completeness.PARTIAL,
                null, Map.of(), List.of(), List.of());
    }
}
