package com.devicepush.orchestrator.domain.exception;

import com.devicepush.orchestrator.push.PushPlatform;

/**
 * The requested platform has no configured provider, or the provider could not be initialized.
 */
public class PlatformUnavailableException extends RuntimeException {

    public PlatformUnavailableException(PushPlatform platform) {
        super("Push platform not available: " + platform.key());
    }
}
