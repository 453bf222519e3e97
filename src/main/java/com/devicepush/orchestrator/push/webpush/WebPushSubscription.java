package com.devicepush.orchestrator.push.webpush;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Browser push subscription as produced by {@code PushSubscription.toJSON()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebPushSubscription(String endpoint, Keys keys) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Keys(String p256dh, String auth) {
    }
}
