package com.stagegate.domain.gate.model;

import java.util.List;

/**
 * Result of applying a {@link GatePolicy} to a project's validation state.
 *
 * @param gate           gate that was evaluated
 * @param status         three-valued outcome
 * @param readinessScore continuous proximity to passing, in [0,1]
 * @param issues         unmet criteria, blocking and advisory
 */
public record GateEvaluation(
        GateId gate,
        GateStatus status,
        double readinessScore,
        List<GateIssue> issues
) {
    public GateEvaluation {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean passed() {
        return status == GateStatus.PASSED;
    }

    public List<GateIssue> blocking() {
        return issues.stream().filter(i -> i.severity() == GateIssue.Severity.BLOCKING).toList();
    }

    public List<GateIssue> advisories() {
        return issues.stream().filter(i -> i.severity() == GateIssue.Severity.ADVISORY).toList();
    }
}
