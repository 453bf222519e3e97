package com.devicepush.orchestrator.domain.exception;

/**
 * The site or device a job targets does not exist.
 */
public class TargetNotFoundException extends RuntimeException {

    public TargetNotFoundException(String message) {
        super(message);
    }
}
