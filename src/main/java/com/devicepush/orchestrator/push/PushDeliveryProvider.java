package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.Authenticator;

import java.util.List;
import java.util.Map;

/**
 * Capability contract shared by every delivery platform.
 *
 * <p>Send operations never throw for expected failures (invalid token, oversized payload, upstream rejection,
 * network trouble); they report them through {@link ProviderResult}.
 */
public interface PushDeliveryProvider extends AutoCloseable {

    PushPlatform platform();

    Authenticator authenticator();

    /**
     * Establishes connections and credentials. Idempotent; returns {@code false} when the provider is unusable.
     */
    boolean initialize();

    boolean isInitialized();

    /**
     * Syntactic check only. Never performs network I/O.
     */
    boolean validateDeviceToken(String deviceToken);

    ProviderResult sendNotification(String deviceToken, NotificationPayload payload);

    /**
     * Returns one result per input, in input order.
     */
    List<ProviderResult> sendBulkNotifications(List<DeviceNotification> notifications);

    ProviderResult sendTopicNotification(String topic, NotificationPayload payload);

    Map<String, Object> getPlatformInfo();

    Map<String, Object> healthCheck();

    @Override
    void close();
}
