package com.stagegate.interfaces.api.dto;

public record VersionConflictResponse(String code, String message, long expectedVersion, long currentVersion) {}
