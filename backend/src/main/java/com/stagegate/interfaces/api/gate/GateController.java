package com.stagegate.interfaces.api.gate;

import com.stagegate.application.gate.GateProgressionService;
import com.stagegate.domain.gate.model.EvidenceItem;
import com.stagegate.domain.gate.model.EvidenceRecord;
import com.stagegate.interfaces.api.TenantResolver;
import com.stagegate.interfaces.api.dto.EvidenceRequest;
import com.stagegate.interfaces.api.dto.EvidenceResponse;
import com.stagegate.interfaces.api.dto.GateCheckResponse;
import com.stagegate.interfaces.api.dto.HypothesesRequest;
import com.stagegate.interfaces.api.dto.ValidationStateResponse;
import com.stagegate.interfaces.api.dto.VersionedRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
public class GateController {

    private final GateProgressionService gateProgressionService;
    private final TenantResolver tenantResolver;

    @PostMapping("/validation")
    public ResponseEntity<ValidationStateResponse> create(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ValidationStateResponse.from(
                gateProgressionService.createProject(tenantResolver.resolve(tenant), projectId)));
    }

    @GetMapping("/validation")
    public ResponseEntity<ValidationStateResponse> get(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId) {
        return ResponseEntity.ok(ValidationStateResponse.from(
                gateProgressionService.getState(tenantResolver.resolve(tenant), projectId)));
    }

    @PostMapping("/evidence")
    public ResponseEntity<EvidenceResponse> recordEvidence(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId,
            @Valid @RequestBody EvidenceRequest request) {
        EvidenceItem item = new EvidenceItem(request.type(), request.strength(), request.qualityScore(),
                request.contradiction());
        EvidenceRecord record = gateProgressionService.recordEvidence(
                tenantResolver.resolve(tenant), projectId, item, request.summary());
        return ResponseEntity.status(HttpStatus.CREATED).body(EvidenceResponse.from(record));
    }

    @PutMapping("/validation/hypotheses")
    public ResponseEntity<ValidationStateResponse> updateHypotheses(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId,
            @Valid @RequestBody HypothesesRequest request) {
        return ResponseEntity.ok(ValidationStateResponse.from(gateProgressionService.updateHypotheses(
                tenantResolver.resolve(tenant), projectId, request.hypothesesCount(), request.expectedVersion())));
    }

    @PostMapping("/validation/evaluate")
    public ResponseEntity<GateCheckResponse> evaluate(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId,
            @Valid @RequestBody(required = false) VersionedRequest request) {
        return ResponseEntity.ok(GateCheckResponse.from(gateProgressionService.evaluate(
                tenantResolver.resolve(tenant), projectId, expectedVersion(request))));
    }

    @PostMapping("/validation/advance")
    public ResponseEntity<ValidationStateResponse> advance(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String projectId,
            @Valid @RequestBody(required = false) VersionedRequest request) {
        return ResponseEntity.ok(ValidationStateResponse.from(gateProgressionService.advance(
                tenantResolver.resolve(tenant), projectId, expectedVersion(request))));
    }

    private Long expectedVersion(VersionedRequest request) {
        return request != null ? request.expectedVersion() : null;
    }
}
