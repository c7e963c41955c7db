package com.stagegate.application.gate;

import com.stagegate.application.exception.DuplicateProjectException;
import com.stagegate.application.exception.InvalidProgressionException;
import com.stagegate.application.exception.ProjectNotFoundException;
import com.stagegate.application.exception.VersionConflictException;
import com.stagegate.domain.gate.model.EvidenceItem;
import com.stagegate.domain.gate.model.EvidenceRecord;
import com.stagegate.domain.gate.model.EvidenceSummary;
import com.stagegate.domain.gate.model.GateEvaluation;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GatePolicy;
import com.stagegate.domain.gate.model.GateStatus;
import com.stagegate.domain.gate.model.ProjectValidationState;
import com.stagegate.domain.gate.repository.EvidenceRecordRepository;
import com.stagegate.domain.gate.repository.ProjectValidationStateRepository;
import com.stagegate.domain.gate.service.EvidenceAggregator;
import com.stagegate.domain.gate.service.GateEvaluator;
import com.stagegate.domain.gate.service.PolicyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Evidence in, gate decisions out: aggregates a project's recorded evidence, evaluates it
 * against the tenant's policy for the current gate and persists the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GateProgressionService {

    private final ProjectValidationStateRepository stateRepository;
    private final EvidenceRecordRepository evidenceRepository;
    private final EvidenceAggregator evidenceAggregator;
    private final PolicyResolver policyResolver;
    private final GateEvaluator gateEvaluator;

    @Value("${gating.gate.readiness-alert-threshold:0.9}")
    private double readinessAlertThreshold;

    @Transactional
    public ProjectValidationState createProject(String tenantId, String projectId) {
        if (stateRepository.existsByProjectId(projectId)) {
            throw new DuplicateProjectException(projectId);
        }
        ProjectValidationState state = stateRepository.save(ProjectValidationState.create(tenantId, projectId));
        log.info("[Gating] Project {} created at {}", projectId, state.getStage());
        return state;
    }

    @Transactional(readOnly = true)
    public ProjectValidationState getState(String tenantId, String projectId) {
        return load(tenantId, projectId);
    }

    @Transactional
    public EvidenceRecord recordEvidence(String tenantId, String projectId, EvidenceItem item, String summary) {
        load(tenantId, projectId);
        EvidenceRecord record = EvidenceRecord.builder()
                .projectId(projectId)
                .type(item.type())
                .strength(item.strength())
                .qualityScore(item.qualityScore())
                .contradiction(item.contradiction())
                .summary(summary)
                .build();
        return evidenceRepository.save(record);
    }

    @Transactional
    public ProjectValidationState updateHypotheses(String tenantId, String projectId, int count, Long expectedVersion) {
        ProjectValidationState state = load(tenantId, projectId);
        VersionConflictException.check(expectedVersion, state.getVersion());
        state.updateHypothesesCount(count);
        return state;
    }

    /**
     * Re-aggregates all evidence, evaluates the current gate and stores metrics, status and readiness.
     *
     * @param expectedVersion optional; a mismatch with the stored version raises {@link VersionConflictException}
     */
    @Transactional
    public GateCheckResult evaluate(String tenantId, String projectId, Long expectedVersion) {
        ProjectValidationState state = load(tenantId, projectId);
        VersionConflictException.check(expectedVersion, state.getVersion());

        List<EvidenceItem> items = evidenceRepository.findByProjectIdOrderByRecordedAtAscIdAsc(projectId).stream()
                .map(EvidenceRecord::toItem)
                .toList();
        EvidenceSummary summary = evidenceAggregator.summarize(items);
        state.applyMetrics(summary);

        GatePolicy policy = policyResolver.resolve(tenantId, state.getStage());
        GateEvaluation evaluation = gateEvaluator.evaluate(state, policy, summary);
        state.applyEvaluation(evaluation);

        String alert = readinessAlert(projectId, evaluation);
        if (alert != null) {
            log.info("[Gating] {}", alert);
        }
        return new GateCheckResult(state, evaluation, summary, alert);
    }

    /**
     * Moves a project whose current gate has passed on to the next gate.
     */
    @Transactional
    public ProjectValidationState advance(String tenantId, String projectId, Long expectedVersion) {
        ProjectValidationState state = load(tenantId, projectId);
        VersionConflictException.check(expectedVersion, state.getVersion());

        GateId current = state.getStage();
        if (!gateEvaluator.canProgress(current, state.getGateStatus())) {
            throw new InvalidProgressionException(current.isFinal() && state.getGateStatus() == GateStatus.PASSED
                    ? "Project " + projectId + " has passed the final gate"
                    : "Gate " + current + " has not passed (status " + state.getGateStatus() + ")");
        }

        GateId next = current.next().orElseThrow();
        state.advanceTo(next);
        log.info("[Gating] Project {} advanced {} -> {}", projectId, current, next);
        return state;
    }

    String readinessAlert(String projectId, GateEvaluation evaluation) {
        if (evaluation.passed() || evaluation.readinessScore() < readinessAlertThreshold) {
            return null;
        }
        long percent = Math.round(evaluation.readinessScore() * 100);
        return String.format(Locale.ROOT, "Project %s is %d%% ready for the %s gate", projectId, percent, evaluation.gate());
    }

    private ProjectValidationState load(String tenantId, String projectId) {
        return stateRepository.findByTenantIdAndProjectId(tenantId, projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }
}
