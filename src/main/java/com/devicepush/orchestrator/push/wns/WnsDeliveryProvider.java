package com.devicepush.orchestrator.push.wns;

import com.devicepush.orchestrator.push.AbstractDeliveryProvider;
import com.devicepush.orchestrator.push.DeviceNotification;
import com.devicepush.orchestrator.push.HttpFailureMapper;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushConfigurationException;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.auth.Authenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Desktop push through Windows Push Notification Services. The device token is the channel URI issued to the app.
 */
public class WnsDeliveryProvider extends AbstractDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(WnsDeliveryProvider.class);

    static final int MAX_PAYLOAD_BYTES = 5000;
    static final int MAX_TTL_SECONDS = 604800;
    private static final int MAX_TAG_LENGTH = 16;
    private static final String CHANNEL_HOST_SUFFIX = "notify.windows.com";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final int batchSize;

    public WnsDeliveryProvider(RestClient restClient, Authenticator authenticator, ObjectMapper objectMapper,
                               int batchSize, Clock clock) {
        super(authenticator, clock);
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        if (batchSize <= 0) {
            throw new PushConfigurationException("WNS batch size must be positive");
        }
        this.batchSize = batchSize;
    }

    @Override
    public PushPlatform platform() {
        return PushPlatform.WNS;
    }

    @Override
    protected boolean doInitialize() {
        return authenticator().refreshToken();
    }

    @Override
    public boolean validateDeviceToken(String channelUri) {
        if (channelUri == null || channelUri.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(channelUri.trim());
            String host = uri.getHost();
            return "https".equalsIgnoreCase(uri.getScheme())
                    && host != null
                    && host.toLowerCase(Locale.ROOT).endsWith(CHANNEL_HOST_SUFFIX);
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    protected ProviderResult doSend(String channelUri, NotificationPayload payload) {
        WnsNotificationType type = WnsNotificationType.fromValue(payload.platformValue("wns_type", null));
        byte[] body = buildBody(type, payload).getBytes(StandardCharsets.UTF_8);
        int size = body.length;
        if (size > MAX_PAYLOAD_BYTES) {
            return payloadTooLarge(size);
        }
        int ttl = Math.min(Math.max(payload.getTtlSeconds(), 0), MAX_TTL_SECONDS);
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(URI.create(channelUri.trim()))
                    .headers(headers -> {
                        authenticator().getAuthHeader().forEach(headers::set);
                        headers.set("X-WNS-Type", type.header());
                        headers.set("X-WNS-TTL", String.valueOf(ttl));
                        headers.set("X-WNS-Cache-Policy", payload.platformValue("cache_policy", "cache"));
                        if (payload.getCollapseKey() != null) {
                            String tag = payload.getCollapseKey();
                            headers.set("X-WNS-Tag", tag.length() > MAX_TAG_LENGTH ? tag.substring(0, MAX_TAG_LENGTH) : tag);
                        }
                    })
                    .contentType(type.contentType())
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("WNS response status [status={}, wnsStatus={}]", response.getStatusCode().value(), response.getHeaders().getFirst("X-WNS-Status"));
            return ProviderResult.sent(platform(), response.getHeaders().getFirst("X-WNS-Msg-ID"));
        } catch (HttpStatusCodeException e) {
            return fromRejection(e);
        } catch (ResourceAccessException e) {
            return HttpFailureMapper.fromTransport(platform(), e);
        }
    }

    @Override
    public List<ProviderResult> sendBulkNotifications(List<DeviceNotification> notifications) {
        List<ProviderResult> results = new ArrayList<>(notifications.size());
        for (int start = 0; start < notifications.size(); start += batchSize) {
            List<DeviceNotification> batch = notifications.subList(start, Math.min(start + batchSize, notifications.size()));
            List<ProviderResult> batchResults = super.sendBulkNotifications(batch);
            log.info("WNS_BATCH_SENT - Batch processed [size={}, success={}]", batch.size(),
                    batchResults.stream().filter(ProviderResult::success).count());
            results.addAll(batchResults);
        }
        return results;
    }

    String buildBody(WnsNotificationType type, NotificationPayload payload) {
        return switch (type) {
            case TOAST -> "<toast><visual><binding template=\"ToastGeneric\">"
                    + "<text>" + escape(payload.getTitle()) + "</text>"
                    + "<text>" + escape(payload.getBody()) + "</text>"
                    + "</binding></visual></toast>";
            case TILE -> "<tile><visual><binding template=\"TileMedium\">"
                    + "<text hint-style=\"subtitle\">" + escape(payload.getTitle()) + "</text>"
                    + "<text hint-style=\"captionSubtle\" hint-wrap=\"true\">" + escape(payload.getBody()) + "</text>"
                    + "</binding></visual></tile>";
            case BADGE -> "<badge value=\"" + escape(payload.platformValue("badge", "alert")) + "\"/>";
            case RAW -> rawJson(payload);
        };
    }

    private String rawJson(NotificationPayload payload) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("title", payload.getTitle());
        raw.put("body", payload.getBody());
        raw.put("data", payload.getData());
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize raw WNS payload", e);
        }
    }

    private ProviderResult fromRejection(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        String errorCode = switch (status) {
            case 400 -> "INVALID_REQUEST";
            case 404 -> PushErrorCodes.CHANNEL_EXPIRED;
            case 405 -> "METHOD_NOT_ALLOWED";
            case 406 -> PushErrorCodes.THROTTLED;
            case 410 -> PushErrorCodes.CHANNEL_GONE;
            default -> HttpFailureMapper.errorCodeForStatus(status);
        };
        String wnsError = e.getResponseHeaders() != null ? e.getResponseHeaders().getFirst("X-WNS-Error-Description") : null;
        log.warn("WNS_REJECTED - WNS rejected notification [status={}, errorCode={}, description={}]", status, errorCode, wnsError);
        return ProviderResult.failed(platform(), errorCode,
                "WNS rejected notification with HTTP " + status + (wnsError != null ? ": " + wnsError : ""),
                HttpFailureMapper.retryAfterSeconds(e.getResponseHeaders()));
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text, StandardCharsets.UTF_8.name());
    }

    @Override
    protected int maxPayloadBytes() {
        return MAX_PAYLOAD_BYTES;
    }

    @Override
    protected String invalidTokenErrorCode() {
        return PushErrorCodes.INVALID_CHANNEL_URI;
    }

    @Override
    protected String genericErrorCode() {
        return PushErrorCodes.WNS_ERROR;
    }

    @Override
    protected Map<String, Object> platformDetails() {
        return Map.of("batch_size", batchSize, "max_ttl_seconds", MAX_TTL_SECONDS);
    }
}
