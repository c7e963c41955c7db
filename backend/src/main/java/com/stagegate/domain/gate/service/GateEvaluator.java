package com.stagegate.domain.gate.service;

import com.stagegate.domain.gate.model.EvidenceStrength;
import com.stagegate.domain.gate.model.EvidenceSummary;
import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateCriterion;
import com.stagegate.domain.gate.model.GateEvaluation;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GateIssue;
import com.stagegate.domain.gate.model.GatePolicy;
import com.stagegate.domain.gate.model.GateStatus;
import com.stagegate.domain.gate.model.ProjectValidationState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies a {@link GatePolicy} to a project's measured evidence.
 *
 * <p>PASS requires all of: evidenceQuality &ge; minQuality, experimentsCount &ge; minExperiments,
 * evidenceCount &ge; minTotalEvidence. A state with nothing measured yet stays PENDING.
 * Strength-mix and evidence-type requirements are reported as advisory issues and never
 * change the status.
 */
@Slf4j
@Component
public class GateEvaluator {

    // absorbs floating-point drift from averaging, e.g. eleven scores of 0.7
    private static final double QUALITY_TOLERANCE = 1e-9;

    public GateEvaluation evaluate(ProjectValidationState state, GatePolicy policy) {
        return evaluate(state, policy, null);
    }

    /**
     * @param summary optional aggregated evidence; when present, advisory checks are added
     */
    public GateEvaluation evaluate(ProjectValidationState state, GatePolicy policy, EvidenceSummary summary) {
        List<GateIssue> issues = new ArrayList<>();

        if (state.getEvidenceQuality() + QUALITY_TOLERANCE < policy.minQuality()) {
            issues.add(GateIssue.blocking(GateCriterion.EVIDENCE_QUALITY, String.format(Locale.ROOT,
                    "Evidence quality too low: %.2f < %.2f", state.getEvidenceQuality(), policy.minQuality())));
        }
        if (state.getExperimentsCount() < policy.minExperiments()) {
            issues.add(GateIssue.blocking(GateCriterion.EXPERIMENTS, String.format(Locale.ROOT,
                    "Insufficient experiments: %d/%d", state.getExperimentsCount(), policy.minExperiments())));
        }
        if (state.getEvidenceCount() < policy.minTotalEvidence()) {
            issues.add(GateIssue.blocking(GateCriterion.TOTAL_EVIDENCE, String.format(Locale.ROOT,
                    "Insufficient evidence: %d/%d", state.getEvidenceCount(), policy.minTotalEvidence())));
        }

        if (summary != null) {
            issues.addAll(advisoryIssues(policy, summary));
        }

        GateStatus status;
        if (state.isUnmeasured()) {
            status = GateStatus.PENDING;
        } else if (issues.stream().anyMatch(i -> i.severity() == GateIssue.Severity.BLOCKING)) {
            status = GateStatus.FAILED;
        } else {
            status = GateStatus.PASSED;
        }

        double readiness = readinessScore(state, policy);
        log.debug("[GateEval] gate={} status={} readiness={} issues={}",
                policy.gate(), status, String.format(Locale.ROOT, "%.3f", readiness), issues.size());

        return new GateEvaluation(policy.gate(), status, readiness, issues);
    }

    /**
     * Unweighted mean of min(1, actual / required) over quality, experiments and total evidence.
     * A zero requirement counts as fully satisfied.
     */
    public double readinessScore(ProjectValidationState state, GatePolicy policy) {
        double quality = ratio(state.getEvidenceQuality(), policy.minQuality());
        double experiments = ratio(state.getExperimentsCount(), policy.minExperiments());
        double evidence = ratio(state.getEvidenceCount(), policy.minTotalEvidence());
        return (quality + experiments + evidence) / 3.0;
    }

    /**
     * A project may move on only from a passed gate that has a successor.
     */
    public boolean canProgress(GateId gate, GateStatus status) {
        return status == GateStatus.PASSED && gate.next().isPresent();
    }

    private List<GateIssue> advisoryIssues(GatePolicy policy, EvidenceSummary summary) {
        List<GateIssue> advisories = new ArrayList<>();

        for (EvidenceStrength strength : EvidenceStrength.values()) {
            int required = policy.minStrength(strength);
            int actual = summary.strengthCount(strength);
            if (actual < required) {
                advisories.add(GateIssue.advisory(GateCriterion.STRENGTH_MIX, String.format(Locale.ROOT,
                        "Insufficient %s evidence: %d/%d", strength.code(), actual, required)));
            }
        }

        List<String> missingTypes = policy.requiredEvidenceTypes().stream()
                .filter(t -> !summary.evidenceTypes().contains(t))
                .sorted()
                .map(EvidenceType::code)
                .toList();
        if (!missingTypes.isEmpty()) {
            advisories.add(GateIssue.advisory(GateCriterion.EVIDENCE_TYPES,
                    "Missing required evidence types: " + String.join(", ", missingTypes)));
        }
        return advisories;
    }

    private double ratio(double actual, double required) {
        if (required <= 0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, actual / required));
    }
}
