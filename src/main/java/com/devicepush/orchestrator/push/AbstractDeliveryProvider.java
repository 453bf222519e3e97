package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.Authenticator;
import com.devicepush.orchestrator.push.auth.PushAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Send pipeline shared by the providers: validate the token without I/O, make sure the provider is initialized,
 * then hand over to the platform. Anything the platform code throws becomes a failed {@link ProviderResult}.
 */
public abstract class AbstractDeliveryProvider implements PushDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractDeliveryProvider.class);

    protected final Clock clock;
    private final Authenticator authenticator;
    private final Object initLock = new Object();
    private volatile boolean initialized;

    private final AtomicLong totalSent = new AtomicLong();
    private final AtomicLong totalSuccess = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private volatile Instant lastSentAt;

    protected AbstractDeliveryProvider(Authenticator authenticator, Clock clock) {
        if (authenticator == null) {
            throw new PushConfigurationException("Authenticator is required");
        }
        this.authenticator = authenticator;
        this.clock = clock;
    }

    @Override
    public Authenticator authenticator() {
        return authenticator;
    }

    @Override
    public boolean initialize() {
        if (initialized) {
            return true;
        }
        synchronized (initLock) {
            if (initialized) {
                return true;
            }
            try {
                initialized = doInitialize();
            } catch (RuntimeException e) {
                log.error("PROVIDER_INIT_FAILED - Provider initialization threw [platform={}, error={}]", platform().key(), e.getMessage());
                initialized = false;
            }
            if (initialized) {
                log.info("PROVIDER_INITIALIZED - Provider ready [platform={}]", platform().key());
            }
            return initialized;
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public final ProviderResult sendNotification(String deviceToken, NotificationPayload payload) {
        if (!validateDeviceToken(deviceToken)) {
            log.warn("PUSH_INVALID_TOKEN - Device token rejected [platform={}, token={}]", platform().key(), tokenPreview(deviceToken));
            return record(ProviderResult.failed(platform(), invalidTokenErrorCode(), "Invalid device token for " + platform().key()));
        }
        if (!initialize()) {
            return record(ProviderResult.failed(platform(), PushErrorCodes.NOT_INITIALIZED, platform().displayName() + " provider is not initialized"));
        }
        try {
            ProviderResult result = doSend(deviceToken, payload);
            if (result.success()) {
                log.info("PUSH_SENT - Notification accepted [platform={}, token={}, messageId={}]", platform().key(), tokenPreview(deviceToken), result.messageId());
            } else {
                log.warn("PUSH_FAILED - Notification rejected [platform={}, token={}, errorCode={}, message={}]",
                        platform().key(), tokenPreview(deviceToken), result.errorCode(), result.message());
            }
            return record(result);
        } catch (PushAuthenticationException e) {
            log.error("PUSH_AUTH_FAILED - No credential for send [platform={}, error={}]", platform().key(), e.getMessage());
            return record(ProviderResult.failed(platform(), PushErrorCodes.AUTH_FAILED, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("PUSH_ERROR - Unexpected send failure [platform={}, token={}, error={}]", platform().key(), tokenPreview(deviceToken), e.getMessage(), e);
            return record(ProviderResult.failed(platform(), genericErrorCode(), e.getMessage()));
        }
    }

    @Override
    public List<ProviderResult> sendBulkNotifications(List<DeviceNotification> notifications) {
        List<ProviderResult> results = new ArrayList<>(notifications.size());
        for (DeviceNotification notification : notifications) {
            results.add(sendNotification(notification.deviceToken(), notification.payload()));
        }
        return results;
    }

    @Override
    public ProviderResult sendTopicNotification(String topic, NotificationPayload payload) {
        return ProviderResult.failed(platform(), PushErrorCodes.TOPICS_NOT_SUPPORTED,
                platform().displayName() + " does not support topic notifications");
    }

    @Override
    public Map<String, Object> getPlatformInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("platform", platform().key());
        info.put("name", platform().displayName());
        info.put("initialized", initialized);
        info.put("auth_type", authenticator.type().name());
        info.put("max_payload_bytes", maxPayloadBytes());
        info.put("supports_topics", supportsTopics());
        info.put("total_sent", totalSent.get());
        info.put("total_success", totalSuccess.get());
        info.put("total_failed", totalFailed.get());
        info.put("last_sent", lastSentAt);
        info.putAll(platformDetails());
        return info;
    }

    @Override
    public Map<String, Object> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("platform", platform().key());
        health.put("status", initialized ? "healthy" : "unhealthy");
        health.put("token_valid", authenticator.isTokenValid(0));
        health.put("timestamp", clock.instant());
        return health;
    }

    @Override
    public void close() {
        initialized = false;
    }

    protected abstract boolean doInitialize();

    protected abstract ProviderResult doSend(String deviceToken, NotificationPayload payload);

    protected abstract int maxPayloadBytes();

    protected boolean supportsTopics() {
        return false;
    }

    protected String invalidTokenErrorCode() {
        return PushErrorCodes.INVALID_TOKEN;
    }

    protected String genericErrorCode() {
        return PushErrorCodes.SEND_FAILED;
    }

    protected Map<String, Object> platformDetails() {
        return Map.of();
    }

    protected ProviderResult payloadTooLarge(int size) {
        return ProviderResult.failed(platform(), PushErrorCodes.PAYLOAD_TOO_LARGE,
                "Payload of " + size + " bytes exceeds " + maxPayloadBytes() + " byte limit");
    }

    protected ProviderResult record(ProviderResult result) {
        totalSent.incrementAndGet();
        if (result.success()) {
            totalSuccess.incrementAndGet();
        } else {
            totalFailed.incrementAndGet();
        }
        lastSentAt = clock.instant();
        return result;
    }

    protected static String tokenPreview(String token) {
        if (token == null) {
            return null;
        }
        return token.length() > 8 ? token.substring(0, 8) + "…" : token;
    }
}
