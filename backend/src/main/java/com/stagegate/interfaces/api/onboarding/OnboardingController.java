package com.stagegate.interfaces.api.onboarding;

import com.stagegate.application.onboarding.OnboardingTurnService;
import com.stagegate.application.onboarding.TurnOutcome;
import com.stagegate.domain.onboarding.model.OnboardingSession;
import com.stagegate.domain.onboarding.service.StageCatalog;
import com.stagegate.interfaces.api.TenantResolver;
import com.stagegate.interfaces.api.dto.SessionResponse;
import com.stagegate.interfaces.api.dto.StartSessionRequest;
import com.stagegate.interfaces.api.dto.TurnRequest;
import com.stagegate.interfaces.api.dto.TurnResponse;
import com.stagegate.interfaces.api.dto.VersionedRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/onboarding/sessions")
@RequiredArgsConstructor
public class OnboardingController {

    private final OnboardingTurnService onboardingTurnService;
    private final StageCatalog stageCatalog;
    private final TenantResolver tenantResolver;

    @PostMapping
    public ResponseEntity<SessionResponse> start(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @Valid @RequestBody StartSessionRequest request) {
        OnboardingSession session = onboardingTurnService.start(tenantResolver.resolve(tenant), request.flow());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> get(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String sessionId) {
        return ResponseEntity.ok(toResponse(onboardingTurnService.get(tenantResolver.resolve(tenant), sessionId)));
    }

    @PostMapping("/{sessionId}/turns")
    public ResponseEntity<TurnResponse> applyTurn(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String sessionId,
            @Valid @RequestBody TurnRequest request) {
        TurnOutcome outcome = onboardingTurnService.applyTurn(
                tenantResolver.resolve(tenant), sessionId, request.toCommand());
        return ResponseEntity.ok(new TurnResponse(toResponse(outcome.session()), outcome.assessmentKey(),
                outcome.replayed(), outcome.advanced(), outcome.completionReady()));
    }

    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<SessionResponse> complete(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String sessionId,
            @Valid @RequestBody(required = false) VersionedRequest request) {
        Long expectedVersion = request != null ? request.expectedVersion() : null;
        return ResponseEntity.ok(toResponse(
                onboardingTurnService.complete(tenantResolver.resolve(tenant), sessionId, expectedVersion)));
    }

    private SessionResponse toResponse(OnboardingSession session) {
        String stageName = stageCatalog.getOrFirst(session.getFlow(), session.getStageNumber()).name();
        return SessionResponse.from(session, stageName);
    }
}
