package com.devicepush.orchestrator.push.apns;

import com.devicepush.orchestrator.push.AbstractDeliveryProvider;
import com.devicepush.orchestrator.push.HttpFailureMapper;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.PushPriority;
import com.devicepush.orchestrator.push.auth.Authenticator;
import com.eatthepath.pushy.apns.ApnsClient;
import com.eatthepath.pushy.apns.DeliveryPriority;
import com.eatthepath.pushy.apns.PushNotificationResponse;
import com.eatthepath.pushy.apns.PushType;
import com.eatthepath.pushy.apns.util.SimpleApnsPayloadBuilder;
import com.eatthepath.pushy.apns.util.SimpleApnsPushNotification;
import com.eatthepath.pushy.apns.util.concurrent.PushNotificationFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Mobile push through Apple's HTTP/2 provider API using the pushy client. The client signs requests with the
 * same key the {@link com.devicepush.orchestrator.push.auth.SignedTokenAuthenticator} holds.
 */
public class ApnsDeliveryProvider extends AbstractDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(ApnsDeliveryProvider.class);

    static final int MAX_PAYLOAD_BYTES = 4096;
    private static final int MAX_COLLAPSE_ID_LENGTH = 64;

    private final ApnsClient apnsClient;
    private final String bundleId;
    private final boolean sandbox;
    private final Duration sendTimeout;

    public ApnsDeliveryProvider(ApnsClient apnsClient, Authenticator authenticator, String bundleId,
                                boolean sandbox, Duration sendTimeout, Clock clock) {
        super(authenticator, clock);
        this.apnsClient = apnsClient;
        this.bundleId = bundleId;
        this.sandbox = sandbox;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public PushPlatform platform() {
        return PushPlatform.APNS;
    }

    @Override
    protected boolean doInitialize() {
        return authenticator().refreshToken();
    }

    @Override
    public boolean validateDeviceToken(String deviceToken) {
        String normalized = normalizeToken(deviceToken);
        return normalized != null && normalized.matches("[a-fA-F0-9]{64}");
    }

    @Override
    protected ProviderResult doSend(String deviceToken, NotificationPayload payload) {
        String body = buildPayload(payload);
        int size = body.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_PAYLOAD_BYTES) {
            return payloadTooLarge(size);
        }
        SimpleApnsPushNotification notification = new SimpleApnsPushNotification(
                normalizeToken(deviceToken),
                bundleId,
                body,
                payload.expiresAt(),
                payload.getPriority() == PushPriority.LOW ? DeliveryPriority.CONSERVE_POWER : DeliveryPriority.IMMEDIATE,
                PushType.ALERT,
                payload.getCollapseKey() != null ? truncate(payload.getCollapseKey(), MAX_COLLAPSE_ID_LENGTH) : null);

        PushNotificationFuture<SimpleApnsPushNotification, PushNotificationResponse<SimpleApnsPushNotification>> future =
                apnsClient.sendNotification(notification);
        try {
            PushNotificationResponse<SimpleApnsPushNotification> response = future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response.isAccepted()) {
                return ProviderResult.sent(platform(), response.getApnsId() != null ? response.getApnsId().toString() : null);
            }
            return fromRejection(response);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderResult.failed(platform(), PushErrorCodes.TIMEOUT, "APNs did not answer within " + sendTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("APNS_SEND_FAILED - Could not deliver to APNs [sandbox={}, error={}]", sandbox, cause.getMessage());
            return ProviderResult.failed(platform(), PushErrorCodes.NETWORK_ERROR, "Could not reach APNs: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.failed(platform(), PushErrorCodes.APNS_ERROR, "Interrupted while waiting for APNs");
        }
    }

    String buildPayload(NotificationPayload payload) {
        SimpleApnsPayloadBuilder builder = new SimpleApnsPayloadBuilder();
        builder.setAlertTitle(payload.getTitle());
        builder.setAlertBody(payload.getBody());
        builder.setSound(payload.platformValue("sound", "default"));
        payload.getData().forEach(builder::addCustomProperty);
        return builder.build();
    }

    private ProviderResult fromRejection(PushNotificationResponse<SimpleApnsPushNotification> response) {
        String reason = response.getRejectionReason().orElse(null);
        int status = response.getStatusCode();
        String errorCode;
        if (reason == null) {
            errorCode = HttpFailureMapper.errorCodeForStatus(status);
        } else {
            errorCode = switch (reason) {
                case "BadDeviceToken", "DeviceTokenNotForTopic" -> PushErrorCodes.INVALID_TOKEN;
                case "Unregistered", "ExpiredToken" -> PushErrorCodes.UNREGISTERED;
                case "PayloadTooLarge" -> PushErrorCodes.PAYLOAD_TOO_LARGE;
                case "TooManyRequests", "TooManyProviderTokenUpdates" -> PushErrorCodes.TOO_MANY_REQUESTS;
                case "ExpiredProviderToken", "InvalidProviderToken", "MissingProviderToken" -> PushErrorCodes.AUTH_FAILED;
                default -> status == 403 ? PushErrorCodes.AUTH_FAILED : HttpFailureMapper.errorCodeForStatus(status);
            };
        }
        log.warn("APNS_REJECTED - APNs rejected notification [status={}, reason={}, sandbox={}]", status, reason, sandbox);
        return ProviderResult.failed(platform(), errorCode,
                "APNs rejected notification: " + (reason != null ? reason : "HTTP " + status));
    }

    /**
     * Device tokens are registered either as 64 hex characters or as the base64 form of the same 32 bytes.
     */
    static String normalizeToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return null;
        }
        String trimmed = rawToken.trim();
        if (trimmed.matches("[a-fA-F0-9]{64}")) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        try {
            return bytesToHex(Base64.getDecoder().decode(trimmed));
        } catch (IllegalArgumentException e) {
            return trimmed;
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    @Override
    protected int maxPayloadBytes() {
        return MAX_PAYLOAD_BYTES;
    }

    @Override
    protected String genericErrorCode() {
        return PushErrorCodes.APNS_ERROR;
    }

    @Override
    protected Map<String, Object> platformDetails() {
        return Map.of("bundle_id", bundleId, "sandbox", sandbox);
    }
}
