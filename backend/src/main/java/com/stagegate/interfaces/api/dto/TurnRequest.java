package com.stagegate.interfaces.api.dto;

import com.stagegate.application.onboarding.TurnCommand;
import com.stagegate.domain.onboarding.model.Clarity;
import com.stagegate.domain.onboarding.model.Completeness;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.Map;

public record TurnRequest(
        @NotNull(message = "messageIndex is required")
        @PositiveOrZero(message = "messageIndex must not be negative")
        Integer messageIndex,

        @NotNull(message = "stage is required")
        @Min(value = 1, message = "stage must be between 1 and 7")
        @Max(value = 7, message = "stage must be between 1 and 7")
        Integer stage,

        String messageText,

        List<String> topicsCovered,

        @NotNull(message = "coverage is required")
        @DecimalMin(value = "0.0", message = "coverage must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "coverage must be between 0 and 1")
        Double coverage,

        Clarity clarity,

        Completeness completeness,

        String notes,

        Map<String, Object> extractedData,

        List<String> keyInsights,

        List<String> recommendedNextSteps,

        @PositiveOrZero(message = "expectedVersion must not be negative")
        Long expectedVersion
) {
    public TurnCommand toCommand() {
        return new TurnCommand(messageIndex, stage, messageText, topicsCovered, coverage, clarity, completeness,
                notes, extractedData, keyInsights, recommendedNextSteps, expectedVersion);
    }
}
