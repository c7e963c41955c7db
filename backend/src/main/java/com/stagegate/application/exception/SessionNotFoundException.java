package com.stagegate.application.exception;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String sessionId) {
        super("Onboarding session not found: " + sessionId);
    }
}
