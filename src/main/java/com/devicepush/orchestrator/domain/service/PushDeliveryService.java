package com.devicepush.orchestrator.domain.service;

import com.devicepush.orchestrator.config.OrchestratorProperties;
import com.devicepush.orchestrator.domain.exception.PlatformUnavailableException;
import com.devicepush.orchestrator.domain.model.Device;
import com.devicepush.orchestrator.domain.model.DeviceOutcome;
import com.devicepush.orchestrator.domain.model.Job;
import com.devicepush.orchestrator.domain.model.PushDeliveryStatus;
import com.devicepush.orchestrator.domain.model.PushNotification;
import com.devicepush.orchestrator.domain.model.PushNotificationLog;
import com.devicepush.orchestrator.domain.repository.PushNotificationLogRepository;
import com.devicepush.orchestrator.push.DeviceNotification;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushDeliveryProvider;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.PushProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Delivers a job's notification to one device and records the attempt in the notification log.
 */
@Service
@RequiredArgsConstructor
public class PushDeliveryService {

    public static final String MESSAGE_ID_KEY = "message_id";

    private final PushProviderRegistry providerRegistry;
    private final PushNotificationLogRepository logRepository;
    private final OrchestratorProperties properties;
    private final Clock clock;
    private static final Logger log = LoggerFactory.getLogger(PushDeliveryService.class);

    public DeviceOutcome deliver(Job job, Device device, PushNotification notification) {
        PushPlatform platform = device.getPlatform() != null ? device.getPlatform() : properties.getDelivery().getDefaultPlatform();
        String messageId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        ProviderResult result;
        PushDeliveryStatus logStatus;
        if (notification.isExpired(now)) {
            log.warn("PUSH_EXPIRED - Notification expired before delivery [jobId={}, deviceId={}, version={}]", job.getJobId(), device.getDeviceId(), notification.version());
            result = ProviderResult.failed(platform, PushErrorCodes.NOTIFICATION_EXPIRED, "Notification expired before delivery");
            logStatus = PushDeliveryStatus.EXPIRED;
        } else {
            result = providerRegistry.resolve(platform)
                    .map(provider -> provider.sendNotification(device.getPushToken(), toPayload(job, device, notification, messageId)))
                    .orElseGet(() -> ProviderResult.failed(platform, PushErrorCodes.PLATFORM_NOT_CONFIGURED, "No provider available for " + platform.key()));
            logStatus = result.success() ? PushDeliveryStatus.SENT : PushDeliveryStatus.FAILED;
        }

        logRepository.save(PushNotificationLog.builder()
                .messageId(messageId)
                .jobId(job.getJobId())
                .deviceId(device.getDeviceId())
                .provider(platform.key())
                .providerMessageId(result.messageId())
                .status(logStatus)
                .errorCode(result.errorCode())
                .errorMessage(result.success() ? null : result.message())
                .sentAt(now)
                .build());

        log.info("DEVICE_DELIVERY - Delivery attempt recorded [jobId={}, deviceId={}, platform={}, success={}, messageId={}, errorCode={}]",
                job.getJobId(), device.getDeviceId(), platform.key(), result.success(), messageId, result.errorCode());

        return DeviceOutcome.builder()
                .deviceId(device.getDeviceId())
                .platform(platform.key())
                .status(result.success() ? DeviceOutcome.SENT : DeviceOutcome.FAILED)
                .messageId(messageId)
                .errorCode(result.errorCode())
                .detail(result.success() ? null : result.message())
                .timestamp(now)
                .build();
    }

    NotificationPayload toPayload(Job job, Device device, PushNotification notification, String messageId) {
        return NotificationPayload.builder()
                .title("Configuration Update " + notification.version())
                .body("New configuration available for " + device.getDeviceId())
                .putData("config_url", notification.configUrl())
                .putData("config_version", notification.version())
                .putData("priority", notification.priority().name().toLowerCase(Locale.ROOT))
                .putData("job_id", job.getJobId())
                .putData("action", job.getAction())
                .putData(MESSAGE_ID_KEY, messageId)
                .priority(notification.priority())
                .ttlSeconds(notification.ttlSeconds())
                .collapseKey(notification.collapseKey())
                .createdAt(notification.createdAt())
                .build();
    }

    public ProviderResult sendDirect(PushPlatform platform, String deviceToken, NotificationPayload payload) {
        return requireProvider(platform).sendNotification(deviceToken, payload);
    }

    public List<ProviderResult> sendBulk(PushPlatform platform, List<String> deviceTokens, NotificationPayload payload) {
        List<DeviceNotification> notifications = deviceTokens.stream()
                .map(token -> new DeviceNotification(token, payload))
                .toList();
        return requireProvider(platform).sendBulkNotifications(notifications);
    }

    public ProviderResult sendTopic(PushPlatform platform, String topic, NotificationPayload payload) {
        return requireProvider(platform).sendTopicNotification(topic, payload);
    }

    private PushDeliveryProvider requireProvider(PushPlatform platform) {
        return providerRegistry.resolve(platform).orElseThrow(() -> new PlatformUnavailableException(platform));
    }
}
