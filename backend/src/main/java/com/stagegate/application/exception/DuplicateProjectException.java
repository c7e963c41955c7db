package com.stagegate.application.exception;

public class DuplicateProjectException extends RuntimeException {
    public DuplicateProjectException(String projectId) {
        super("Validation state already exists for project " + projectId);
    }
}
