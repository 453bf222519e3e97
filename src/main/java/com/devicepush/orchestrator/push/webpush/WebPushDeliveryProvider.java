package com.devicepush.orchestrator.push.webpush;

import com.devicepush.orchestrator.push.AbstractDeliveryProvider;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushConfigurationException;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.auth.ApiKeyAuthenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Browser push with VAPID. The device token is the JSON-encoded subscription; the authenticator carries the
 * VAPID private key.
 */
public class WebPushDeliveryProvider extends AbstractDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(WebPushDeliveryProvider.class);

    static final int MAX_PAYLOAD_BYTES = 4096;
    private static final int UNCOMPRESSED_P256_POINT_LENGTH = 65;
    private static final List<String> KNOWN_PUSH_SERVICES = List.of(
            "fcm.googleapis.com",
            "updates.push.services.mozilla.com",
            "web.push.apple.com",
            "notify.windows.com");

    private final ApiKeyAuthenticator vapidPrivateKey;
    private final String vapidPublicKey;
    private final String subject;
    private final ObjectMapper objectMapper;
    private volatile PushService pushService;

    public WebPushDeliveryProvider(ApiKeyAuthenticator vapidPrivateKey, String vapidPublicKey, String subject,
                                   ObjectMapper objectMapper, Clock clock) {
        super(vapidPrivateKey, clock);
        if (vapidPublicKey == null || decodedLength(vapidPublicKey) != UNCOMPRESSED_P256_POINT_LENGTH) {
            throw new PushConfigurationException("VAPID public key must be a base64url encoded uncompressed P-256 point");
        }
        if (subject == null || !(subject.startsWith("mailto:") || subject.startsWith("https://"))) {
            throw new PushConfigurationException("VAPID subject must start with mailto: or https://");
        }
        this.vapidPrivateKey = vapidPrivateKey;
        this.vapidPublicKey = vapidPublicKey;
        this.subject = subject;
        this.objectMapper = objectMapper;
    }

    @Override
    public PushPlatform platform() {
        return PushPlatform.WEB_PUSH;
    }

    /**
     * Validation and topic answers work without the crypto backend, so a missing backend does not fail
     * initialization; sends report {@code LIBRARY_NOT_AVAILABLE} instead.
     */
    @Override
    protected boolean doInitialize() {
        try {
            if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
                Security.addProvider(new BouncyCastleProvider());
            }
            pushService = new PushService(vapidPublicKey, vapidPrivateKey.getApiKey(), subject);
        } catch (GeneralSecurityException | RuntimeException | LinkageError e) {
            log.error("WEBPUSH_CRYPTO_UNAVAILABLE - Could not set up VAPID signing [error={}]", e.getMessage());
            pushService = null;
        }
        return true;
    }

    @Override
    public boolean validateDeviceToken(String deviceToken) {
        Optional<WebPushSubscription> subscription = parseSubscription(deviceToken);
        if (subscription.isEmpty()) {
            return false;
        }
        WebPushSubscription sub = subscription.get();
        if (sub.keys() == null || isBlank(sub.keys().p256dh()) || isBlank(sub.keys().auth())) {
            return false;
        }
        try {
            URI endpoint = new URI(sub.endpoint());
            if (endpoint.getScheme() == null || endpoint.getHost() == null) {
                return false;
            }
            if (KNOWN_PUSH_SERVICES.stream().noneMatch(endpoint.getHost()::endsWith)) {
                log.debug("Web push endpoint on unrecognized push service [host={}]", endpoint.getHost());
            }
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    protected ProviderResult doSend(String deviceToken, NotificationPayload payload) {
        PushService service = pushService;
        if (service == null) {
            return ProviderResult.failed(platform(), PushErrorCodes.LIBRARY_NOT_AVAILABLE, "Web push crypto backend is not available");
        }
        WebPushSubscription subscription = parseSubscription(deviceToken).orElseThrow();
        String body = buildBody(payload);
        int size = body.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_PAYLOAD_BYTES) {
            return payloadTooLarge(size);
        }
        try {
            Notification notification = new Notification(subscription.endpoint(),
                    subscription.keys().p256dh(), subscription.keys().auth(), body);
            int status = service.send(notification).getStatusLine().getStatusCode();
            if (status >= 200 && status < 300) {
                return ProviderResult.sent(platform(), null);
            }
            return fromStatus(status);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (e instanceof IOException) {
                return ProviderResult.failed(platform(), PushErrorCodes.NETWORK_ERROR, "Could not reach push service: " + e.getMessage());
            }
            log.error("WEBPUSH_SEND_ERROR - Web push send failed [error={}]", e.getMessage());
            return ProviderResult.failed(platform(), PushErrorCodes.WEBPUSH_ERROR, e.getMessage());
        }
    }

    private ProviderResult fromStatus(int status) {
        String errorCode = switch (status) {
            case 404 -> PushErrorCodes.SUBSCRIPTION_NOT_FOUND;
            case 410 -> PushErrorCodes.SUBSCRIPTION_EXPIRED;
            case 413 -> PushErrorCodes.PAYLOAD_TOO_LARGE;
            case 429 -> PushErrorCodes.TOO_MANY_REQUESTS;
            default -> PushErrorCodes.WEBPUSH_ERROR;
        };
        return ProviderResult.failed(platform(), errorCode, "Push service responded with HTTP " + status);
    }

    String buildBody(NotificationPayload payload) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("title", payload.getTitle());
        notification.put("body", payload.getBody());
        if (payload.getCollapseKey() != null) {
            notification.put("tag", payload.getCollapseKey());
        }
        notification.put("requireInteraction", payload.getPriority().isUrgent());
        notification.put("timestamp", payload.getCreatedAt().toEpochMilli());
        notification.put("data", payload.getData());
        try {
            return objectMapper.writeValueAsString(Map.of("notification", notification));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize web push payload", e);
        }
    }

    private Optional<WebPushSubscription> parseSubscription(String deviceToken) {
        if (isBlank(deviceToken)) {
            return Optional.empty();
        }
        try {
            WebPushSubscription subscription = objectMapper.readValue(deviceToken, WebPushSubscription.class);
            return isBlank(subscription.endpoint()) ? Optional.empty() : Optional.of(subscription);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static int decodedLength(String base64Url) {
        try {
            return Base64.getUrlDecoder().decode(base64Url.trim()).length;
        } catch (IllegalArgumentException e) {
            return -1;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    protected int maxPayloadBytes() {
        return MAX_PAYLOAD_BYTES;
    }

    @Override
    protected String invalidTokenErrorCode() {
        return PushErrorCodes.INVALID_SUBSCRIPTION;
    }

    @Override
    protected String genericErrorCode() {
        return PushErrorCodes.WEBPUSH_ERROR;
    }

    @Override
    protected Map<String, Object> platformDetails() {
        return Map.of("subject", subject, "crypto_available", pushService != null);
    }
}
