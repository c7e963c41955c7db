package com.stagegate.application.exception;

import lombok.Getter;

/**
 * The caller's expected version no longer matches the stored one.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final long expectedVersion;
    private final long currentVersion;

    public VersionConflictException(long expectedVersion, long currentVersion) {
        super("Version conflict: expected " + expectedVersion + " but current is " + currentVersion);
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    /**
     * No-op when {@code expected} is null.
     */
    public static void check(Long expected, Long current) {
        long actual = current != null ? current : 0L;
        if (expected != null && expected != actual) {
            throw new VersionConflictException(expected, actual);
        }
    }
}
