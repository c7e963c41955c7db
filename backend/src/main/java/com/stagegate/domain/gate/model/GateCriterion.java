package com.stagegate.domain.gate.model;

public enum GateCriterion {
    EVIDENCE_QUALITY,
    EXPERIMENTS,
    TOTAL_EVIDENCE,
    STRENGTH_MIX,
    EVIDENCE_TYPES
}
