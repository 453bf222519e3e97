package com.devicepush.orchestrator.push;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of delivery platforms. Every device, provider and log row refers to one of these.
 */
public enum PushPlatform {

    FCM("fcm", "Firebase Cloud Messaging"),
    APNS("apns", "Apple Push Notification service"),
    WNS("wns", "Windows Push Notification Services"),
    WEB_PUSH("web_push", "Web Push (VAPID)"),
    MQTT("mqtt", "MQTT broker");

    private final String key;
    private final String displayName;

    PushPlatform(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a platform from its configuration key ({@code fcm}, {@code web_push}, ...) or enum name.
     *
     * @throws IllegalArgumentException when the key names no known platform
     */
    public static PushPlatform fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Push platform must not be blank");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(p -> p.key.equals(normalized) || p.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown push platform: " + key));
    }
}
