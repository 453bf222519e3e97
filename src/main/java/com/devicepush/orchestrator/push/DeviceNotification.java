package com.devicepush.orchestrator.push;

/**
 * One (device token, payload) pair of a bulk send.
 */
public record DeviceNotification(String deviceToken, NotificationPayload payload) {
}
