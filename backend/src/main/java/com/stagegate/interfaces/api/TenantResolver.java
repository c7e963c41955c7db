package com.stagegate.interfaces.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps the optional tenant header to a tenant id.
 */
@Component
public class TenantResolver {

    public static final String HEADER = "X-Tenant-Id";

    @Value("${gating.tenant.default-id:default}")
    private String defaultTenantId;

    public String resolve(String headerValue) {
        return headerValue == null || headerValue.isBlank() ? defaultTenantId : headerValue.trim();
    }
}
