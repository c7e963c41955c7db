package com.stagegate.application.onboarding;

import com.stagegate.application.exception.InvalidProgressionException;
import com.stagegate.application.exception.SessionNotFoundException;
import com.stagegate.application.exception.VersionConflictException;
import com.stagegate.domain.onboarding.model.ExtractedValue;
import com.stagegate.domain.onboarding.model.OnboardingFlow;
import com.stagegate.domain.onboarding.model.OnboardingSession;
import com.stagegate.domain.onboarding.model.QualityAssessment;
import com.stagegate.domain.onboarding.model.StageConfig;
import com.stagegate.domain.onboarding.repository.OnboardingSessionRepository;
import com.stagegate.domain.onboarding.service.BriefSchema;
import com.stagegate.domain.onboarding.service.CompletionPolicy;
import com.stagegate.domain.onboarding.service.DataMerger;
import com.stagegate.domain.onboarding.service.ProgressCalculator;
import com.stagegate.domain.onboarding.service.StageCatalog;
import com.stagegate.domain.onboarding.service.StageProgressionController;
import com.stagegate.infrastructure.cache.AssessmentCacheKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Applies assessed conversational turns to onboarding sessions.
 *
 * <p>A turn is: dedupe by assessment key → count messages → validate and merge extracted data
 * → decide stage advancement → recompute progress. Sessions are never completed here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnboardingTurnService {

    /** User message plus assistant reply. */
    static final int MESSAGES_PER_TURN = 2;

    private final OnboardingSessionRepository sessionRepository;
    private final StageCatalog stageCatalog;
    private final BriefSchema briefSchema;
    private final DataMerger dataMerger;
    private final StageProgressionController progressionController;
    private final CompletionPolicy completionPolicy;
    private final ProgressCalculator progressCalculator;
    private final AssessmentCacheKey assessmentCacheKey;

    @Transactional
    public OnboardingSession start(String tenantId, OnboardingFlow flow) {
        OnboardingSession session = sessionRepository.save(OnboardingSession.start(tenantId, flow));
        log.info("[Onboarding] Session {} started ({})", session.getSessionId(), flow);
        return session;
    }

    @Transactional(readOnly = true)
    public OnboardingSession get(String tenantId, String sessionId) {
        return load(tenantId, sessionId);
    }

    /**
     * A turn is identified by the message index and the stage it was sent at, both taken from the
     * request so a retry hashes to the same key after the first attempt has moved the session on.
     */
    @Transactional
    public TurnOutcome applyTurn(String tenantId, String sessionId, TurnCommand command) {
        if (command.messageIndex() == null || command.stage() == null) {
            throw new IllegalArgumentException("messageIndex and stage are required to identify a turn");
        }
        OnboardingSession session = load(tenantId, sessionId);

        int stageNumber = command.stage();
        String key = assessmentCacheKey.key(sessionId, command.messageIndex(), stageNumber, command.messageText());
        if (key.equals(session.getLastAssessmentKey())) {
            log.info("[Onboarding] Turn {} already applied to session {}", key, sessionId);
            return new TurnOutcome(session, key, true, false, false);
        }

        if (session.isCompleted()) {
            throw new InvalidProgressionException("Session " + sessionId + " is already completed");
        }
        VersionConflictException.check(command.expectedVersion(), session.getVersion());
        if (stageNumber != session.getStageNumber()) {
            throw new InvalidProgressionException("Turn was sent at stage " + stageNumber
                    + " but session " + sessionId + " is at stage " + session.getStageNumber());
        }

        session.recordMessages(MESSAGES_PER_TURN);

        Map<String, ExtractedValue> extracted = briefSchema.parse(session.getFlow(), command.extractedData());
        Map<String, ExtractedValue> merged = dataMerger.merge(dataMerger.tag(session.getCollectedData()), extracted);
        session.replaceCollectedData(dataMerger.render(merged));

        QualityAssessment assessment = new QualityAssessment(command.topicsCovered(), command.coverage(),
                command.clarity(), command.completeness(), command.notes(), extracted,
                command.keyInsights(), command.recommendedNextSteps());

        StageConfig stage = stageCatalog.getOrFirst(session.getFlow(), stageNumber);
        boolean advanced = progressionController.shouldAdvance(assessment, stage, session.getStageMessageCount());
        boolean completionReady = completionPolicy.isReadyToComplete(assessment, stageNumber);
        if (advanced) {
            session.advanceStage();
            log.info("[Onboarding] Session {} advanced to stage {}", sessionId, session.getStageNumber());
        }

        double coverageInStage = advanced ? 0.0 : assessment.coverage();
        session.updateProgress(progressCalculator.percent(session.getStageNumber(), coverageInStage, false));
        session.markAssessed(key);

        if (completionReady) {
            log.info("[Onboarding] Session {} is ready to complete", sessionId);
        }
        return new TurnOutcome(session, key, false, advanced, completionReady);
    }

    /**
     * Explicit completion. Only a session on the final stage can be completed.
     */
    @Transactional
    public OnboardingSession complete(String tenantId, String sessionId, Long expectedVersion) {
        OnboardingSession session = load(tenantId, sessionId);
        VersionConflictException.check(expectedVersion, session.getVersion());
        if (session.isCompleted()) {
            return session;
        }
        if (!stageCatalog.isFinalStage(session.getStageNumber())) {
            throw new InvalidProgressionException("Session " + sessionId + " is on stage "
                    + session.getStageNumber() + " of " + StageCatalog.TOTAL_STAGES);
        }
        session.complete();
        log.info("[Onboarding] Session {} completed", sessionId);
        return session;
    }

    private OnboardingSession load(String tenantId, String sessionId) {
        return sessionRepository.findBySessionIdAndTenantId(sessionId, tenantId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
