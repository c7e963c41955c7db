package com.stagegate.interfaces.api.dto;

import com.stagegate.application.gate.GateCheckResult;
import com.stagegate.domain.gate.model.GateIssue;

import java.util.List;

public record GateCheckResponse(
        ValidationStateResponse state,
        List<IssueDto> issues,
        String readinessAlert
) {
    public record IssueDto(String criterion, String severity, String message) {
        static IssueDto from(GateIssue issue) {
            return new IssueDto(issue.criterion().name(), issue.severity().name(), issue.message());
        }
    }

    public static GateCheckResponse from(GateCheckResult result) {
        return new GateCheckResponse(
                ValidationStateResponse.from(result.state()),
                result.evaluation().issues().stream().map(IssueDto::from).toList(),
                result.readinessAlert());
    }
}
