package com.devicepush.orchestrator.domain.model;

import com.devicepush.orchestrator.push.PushPriority;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Notification built once per job and fanned out to every target device.
 */
public record PushNotification(String configUrl,
                               String version,
                               int ttlSeconds,
                               String collapseKey,
                               PushPriority priority,
                               Instant createdAt) {

    public PushNotification {
        if (collapseKey == null || collapseKey.isBlank()) {
            collapseKey = "config-" + version;
        }
        if (priority == null) {
            priority = PushPriority.HIGH;
        }
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(createdAt.plusSeconds(ttlSeconds));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("config_url", configUrl);
        map.put("version", version);
        map.put("ttl_seconds", ttlSeconds);
        map.put("collapse_key", collapseKey);
        map.put("priority", priority.name().toLowerCase(Locale.ROOT));
        map.put("created_at", createdAt.toString());
        return map;
    }
}
