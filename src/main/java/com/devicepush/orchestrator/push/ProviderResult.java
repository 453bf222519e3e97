package com.devicepush.orchestrator.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of a single delivery attempt. Providers return this for every expected failure instead of throwing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResult(boolean success,
                             String message,
                             PushPlatform platform,
                             String messageId,
                             String errorCode,
                             Integer retryAfterSeconds) {

    public static ProviderResult sent(PushPlatform platform, String messageId) {
        return new ProviderResult(true, "Notification sent", platform, messageId, null, null);
    }

    public static ProviderResult failed(PushPlatform platform, String errorCode, String message) {
        return new ProviderResult(false, message, platform, null, errorCode, null);
    }

    public static ProviderResult failed(PushPlatform platform, String errorCode, String message, Integer retryAfterSeconds) {
        return new ProviderResult(false, message, platform, null, errorCode, retryAfterSeconds);
    }
}
