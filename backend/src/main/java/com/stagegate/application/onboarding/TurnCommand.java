package com.stagegate.application.onboarding;

import com.stagegate.domain.onboarding.model.Clarity;
import com.stagegate.domain.onboarding.model.Completeness;

import java.util.List;
import java.util.Map;

/**
 * One assessed conversational turn as posted by the host.
 *
 * @param messageIndex    position of the user message in the conversation
 * @param stage           stage the session was at when the message was sent
 * @param extractedData   raw extracted values, hedged strings carrying the uncertainty prefix
 * @param expectedVersion optional optimistic-concurrency check
 */
public record TurnCommand(
        Integer messageIndex,
        Integer stage,
        String messageText,
        List<String> topicsCovered,
        double coverage,
        Clarity clarity,
        Completeness completeness,
        String notes,
        Map<String, Object> extractedData,
        List<String> keyInsights,
        List<String> recommendedNextSteps,
        Long expectedVersion
) {
}
