package com.devicepush.orchestrator.push.auth;

public class PushAuthenticationException extends RuntimeException {

    public PushAuthenticationException(String message) {
        super(message);
    }
}
