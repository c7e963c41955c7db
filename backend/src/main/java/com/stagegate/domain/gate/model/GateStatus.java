package com.stagegate.domain.gate.model;

/**
 * PENDING means no meaningful evaluation has run yet; FAILED means one did and found the evidence insufficient.
 */
public enum GateStatus {
    PENDING,
    PASSED,
    FAILED
}
