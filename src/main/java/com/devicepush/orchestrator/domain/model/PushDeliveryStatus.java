package com.devicepush.orchestrator.domain.model;

import java.util.Locale;

public enum PushDeliveryStatus {
    SENT,
    DELIVERED,
    FAILED,
    EXPIRED;

    /**
     * Maps a status reported by a device. Anything unrecognized counts as delivered.
     */
    public static PushDeliveryStatus fromAck(String value) {
        if (value == null || value.isBlank()) {
            return DELIVERED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DELIVERED;
        }
    }
}
