package com.stagegate.application.onboarding;

import com.stagegate.domain.onboarding.model.OnboardingSession;

/**
 * @param replayed        the turn's assessment key was already applied; the session is unchanged
 * @param advanced        the session moved to the next stage
 * @param completionReady the final stage produced what an explicit completion needs
 */
public record TurnOutcome(
        OnboardingSession session,
        String assessmentKey,
        boolean replayed,
        boolean advanced,
        boolean completionReady
) {
}
