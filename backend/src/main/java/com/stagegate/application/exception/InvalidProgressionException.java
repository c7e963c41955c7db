package com.stagegate.application.exception;

/**
 * Requested move is not allowed from the current state, e.g. advancing a gate that has not passed.
 */
public class InvalidProgressionException extends RuntimeException {
    public InvalidProgressionException(String message) {
        super(message);
    }
}
