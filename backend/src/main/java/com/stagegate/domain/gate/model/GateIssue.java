package com.stagegate.domain.gate.model;

/**
 * Unmet gate criterion.
 *
 * @param criterion the criterion that was not met
 * @param severity  BLOCKING issues decide the gate status, ADVISORY ones are reported only
 * @param message   human-readable reason
 */
public record GateIssue(
        GateCriterion criterion,
        Severity severity,
        String message
) {
    public enum Severity {
        BLOCKING,
        ADVISORY
    }

    public static GateIssue blocking(GateCriterion criterion, String message) {
        return new GateIssue(criterion, Severity.BLOCKING, message);
    }

    public static GateIssue advisory(GateCriterion criterion, String message) {
        return new GateIssue(criterion, Severity.ADVISORY, message);
    }
}
