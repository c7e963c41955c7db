package com.stagegate.interfaces.api.gate;

import com.stagegate.application.gate.GatePolicyService;
import com.stagegate.interfaces.api.TenantResolver;
import com.stagegate.interfaces.api.dto.GatePolicyRequest;
import com.stagegate.interfaces.api.dto.GatePolicyResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings/gate-policies")
@RequiredArgsConstructor
public class GatePolicyController {

    private final GatePolicyService gatePolicyService;
    private final TenantResolver tenantResolver;

    @GetMapping("/{gate}")
    public ResponseEntity<GatePolicyResponse> get(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String gate) {
        return ResponseEntity.ok(GatePolicyResponse.from(gatePolicyService.get(tenantResolver.resolve(tenant), gate)));
    }

    @PutMapping("/{gate}")
    public ResponseEntity<GatePolicyResponse> upsert(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String gate,
            @Valid @RequestBody GatePolicyRequest request) {
        return ResponseEntity.ok(GatePolicyResponse.from(
                gatePolicyService.upsert(tenantResolver.resolve(tenant), gate, request.toCommand())));
    }

    @DeleteMapping("/{gate}")
    public ResponseEntity<GatePolicyResponse> reset(
            @RequestHeader(value = TenantResolver.HEADER, required = false) String tenant,
            @PathVariable String gate) {
        return ResponseEntity.ok(GatePolicyResponse.from(gatePolicyService.reset(tenantResolver.resolve(tenant), gate)));
    }
}
