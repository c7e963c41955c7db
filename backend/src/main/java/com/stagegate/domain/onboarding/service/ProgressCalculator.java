package com.stagegate.domain.onboarding.service;

import org.springframework.stereotype.Component;

/**
 * Display percentage for an onboarding session.
 * Stages share 85%, each contributing up to floor(85 / 7) by coverage; capped at 95 until completed.
 */
@Component
public class ProgressCalculator {

    private static final int STAGE_SHARE = 85;
    private static final int STAGE_WEIGHT = STAGE_SHARE / StageCatalog.TOTAL_STAGES;
    private static final int INCOMPLETE_CAP = 95;

    public int percent(int stage, double coverageWithinStage, boolean completed) {
        if (completed) {
            return 100;
        }
        int boundedStage = Math.max(1, Math.min(StageCatalog.TOTAL_STAGES, stage));
        double coverage = Double.isNaN(coverageWithinStage) ? 0.0 : Math.max(0.0, Math.min(1.0, coverageWithinStage));

        int base = (int) Math.floor((boundedStage - 1) / (double) StageCatalog.TOTAL_STAGES * STAGE_SHARE);
        int withinStage = (int) Math.floor(coverage * STAGE_WEIGHT);
        return Math.min(INCOMPLETE_CAP, base + withinStage);
    }
}
