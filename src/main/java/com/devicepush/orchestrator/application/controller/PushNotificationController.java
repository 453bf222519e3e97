package com.devicepush.orchestrator.application.controller;

import com.devicepush.orchestrator.application.dto.SendNotificationRequest;
import com.devicepush.orchestrator.domain.service.PushDeliveryService;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.PushPriority;
import com.devicepush.orchestrator.push.PushProviderRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct sends outside of a job, for diagnostics and integration checks.
 */
@RestController
@RequestMapping("/api/v1/push")
@RequiredArgsConstructor
public class PushNotificationController {

    private final PushDeliveryService pushDeliveryService;
    private final PushProviderRegistry providerRegistry;
    private final Clock clock;
    private static final Logger log = LoggerFactory.getLogger(PushNotificationController.class);

    @PostMapping("/send")
    public ResponseEntity<ProviderResult> send(@Valid @RequestBody SendNotificationRequest request) {
        PushPlatform platform = PushPlatform.fromKey(request.getPlatform());
        requireValue(request.getDeviceToken(), "device_token");
        log.info("Direct send: platform={}, title='{}'", platform.key(), request.getTitle());
        ProviderResult result = pushDeliveryService.sendDirect(platform, request.getDeviceToken(), toPayload(request));
        return ResponseEntity.status(ProviderResultStatus.of(result)).body(result);
    }

    @PostMapping("/bulk")
    public ResponseEntity<Map<String, Object>> bulk(@Valid @RequestBody SendNotificationRequest request) {
        PushPlatform platform = PushPlatform.fromKey(request.getPlatform());
        if (request.getDeviceTokens() == null || request.getDeviceTokens().isEmpty()) {
            throw new IllegalArgumentException("device_tokens is required");
        }
        log.info("Bulk send: platform={}, tokens={}", platform.key(), request.getDeviceTokens().size());
        List<ProviderResult> results = pushDeliveryService.sendBulk(platform, request.getDeviceTokens(), toPayload(request));
        long successful = results.stream().filter(ProviderResult::success).count();
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("total", results.size());
        resp.put("successful", successful);
        resp.put("failed", results.size() - successful);
        resp.put("results", results);
        return ResponseEntity.ok(resp);
    }

    @PostMapping("/topic")
    public ResponseEntity<ProviderResult> topic(@Valid @RequestBody SendNotificationRequest request) {
        PushPlatform platform = PushPlatform.fromKey(request.getPlatform());
        requireValue(request.getTopic(), "topic");
        log.info("Topic send: platform={}, topic={}", platform.key(), request.getTopic());
        ProviderResult result = pushDeliveryService.sendTopic(platform, request.getTopic(), toPayload(request));
        return ResponseEntity.status(ProviderResultStatus.of(result)).body(result);
    }

    @GetMapping("/platforms")
    public Map<String, Object> platforms() {
        return providerRegistry.platformInfo();
    }

    private NotificationPayload toPayload(SendNotificationRequest request) {
        NotificationPayload.NotificationPayloadBuilder builder = NotificationPayload.builder()
                .title(request.getTitle())
                .body(request.getBody())
                .priority(request.getPriority() != null ? request.getPriority() : PushPriority.NORMAL)
                .collapseKey(request.getCollapseKey())
                .createdAt(clock.instant());
        if (request.getData() != null) {
            builder.data(request.getData());
        }
        if (request.getPlatformData() != null) {
            builder.platformData(request.getPlatformData());
        }
        if (request.getTtlSeconds() != null) {
            builder.ttlSeconds(request.getTtlSeconds());
        }
        return builder.build();
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
