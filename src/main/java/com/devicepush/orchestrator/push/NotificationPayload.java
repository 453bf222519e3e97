package com.devicepush.orchestrator.push;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Platform-neutral notification content handed to a {@link PushDeliveryProvider}.
 */
@Value
@Builder(toBuilder = true)
public class NotificationPayload {

    public static final int DEFAULT_TTL_SECONDS = 300;

    String title;
    String body;
    @Singular("putData")
    Map<String, String> data;
    @Builder.Default
    PushPriority priority = PushPriority.NORMAL;
    @Builder.Default
    int ttlSeconds = DEFAULT_TTL_SECONDS;
    String collapseKey;
    @Singular("putPlatformData")
    Map<String, String> platformData;
    @NonNull
    Instant createdAt;

    public Instant expiresAt() {
        return createdAt.plusSeconds(ttlSeconds);
    }

    public String platformValue(String key, String fallback) {
        String value = platformData.get(key);
        return value != null && !value.isBlank() ? value : fallback;
    }
}
