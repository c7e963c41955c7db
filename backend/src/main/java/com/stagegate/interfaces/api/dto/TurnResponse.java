package com.stagegate.interfaces.api.dto;

public record TurnResponse(
        SessionResponse session,
        String assessmentKey,
        boolean replayed,
        boolean advanced,
        boolean completionReady
) {}
