package com.devicepush.orchestrator.push;

/**
 * Raised while building a provider or authenticator when required settings are missing or malformed.
 */
public class PushConfigurationException extends RuntimeException {

    public PushConfigurationException(String message) {
        super(message);
    }

    public PushConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
