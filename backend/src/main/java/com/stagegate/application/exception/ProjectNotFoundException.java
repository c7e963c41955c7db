package com.stagegate.application.exception;

public class ProjectNotFoundException extends RuntimeException {
    public ProjectNotFoundException(String projectId) {
        super("No validation state for project " + projectId);
    }
}
