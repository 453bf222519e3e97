package com.devicepush.orchestrator.domain.service;

import com.devicepush.orchestrator.MutableClock;
import com.devicepush.orchestrator.config.OrchestratorProperties;
import com.devicepush.orchestrator.domain.exception.PlatformUnavailableException;
import com.devicepush.orchestrator.domain.model.Device;
import com.devicepush.orchestrator.domain.model.DeviceOutcome;
import com.devicepush.orchestrator.domain.model.Job;
import com.devicepush.orchestrator.domain.model.PushDeliveryStatus;
import com.devicepush.orchestrator.domain.model.PushNotification;
import com.devicepush.orchestrator.domain.model.PushNotificationLog;
import com.devicepush.orchestrator.domain.repository.PushNotificationLogRepository;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushDeliveryProvider;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.PushPriority;
import com.devicepush.orchestrator.push.PushProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PushDeliveryServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private PushNotificationLogRepository logRepository;
    private PushDeliveryProvider wns;
    private PushDeliveryService service;
    private Job job;

    @BeforeEach
    void setUp() {
        logRepository = mock(PushNotificationLogRepository.class);
        wns = mock(PushDeliveryProvider.class);
        when(wns.platform()).thenReturn(PushPlatform.WNS);
        when(wns.initialize()).thenReturn(true);
        service = new PushDeliveryService(new PushProviderRegistry(List.of(wns)), logRepository, new OrchestratorProperties(), clock);
        job = Job.builder()
                .jobId("job-1")
                .action("config_update")
                .siteId("site-1")
                .configUrl("https://config.example.com/site-1/pos/v3.json")
                .configVersion("v3")
                .ttlSeconds(300)
                .createdAt(clock.instant())
                .build();
    }

    private PushNotification notification() {
        return new PushNotification(job.getConfigUrl(), "v3", 300, null, PushPriority.HIGH, clock.instant());
    }

    private static Device wnsDevice() {
        return Device.builder().deviceId("pos-1").siteId("site-1").platform(PushPlatform.WNS)
                .pushToken("https://db5.notify.windows.com/?token=abc").build();
    }

    @Test
    void sendsPayloadWithTrackingIdAndLogsAttempt() {
        when(wns.sendNotification(anyString(), any(NotificationPayload.class))).thenReturn(ProviderResult.sent(PushPlatform.WNS, "wns-1"));

        DeviceOutcome outcome = service.deliver(job, wnsDevice(), notification());

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(wns).sendNotification(eq("https://db5.notify.windows.com/?token=abc"), payload.capture());
        assertEquals("Configuration Update v3", payload.getValue().getTitle());
        assertEquals("New configuration available for pos-1", payload.getValue().getBody());
        assertEquals(outcome.getMessageId(), payload.getValue().getData().get(PushDeliveryService.MESSAGE_ID_KEY));
        assertEquals("job-1", payload.getValue().getData().get("job_id"));
        assertEquals("high", payload.getValue().getData().get("priority"));
        assertEquals("config-v3", payload.getValue().getCollapseKey());

        ArgumentCaptor<PushNotificationLog> logged = ArgumentCaptor.forClass(PushNotificationLog.class);
        verify(logRepository).save(logged.capture());
        assertEquals(outcome.getMessageId(), logged.getValue().getMessageId());
        assertEquals("wns-1", logged.getValue().getProviderMessageId());
        assertEquals(PushDeliveryStatus.SENT, logged.getValue().getStatus());
        assertEquals(DeviceOutcome.SENT, outcome.getStatus());
    }

    @Test
    void unconfiguredPlatformFailsDevice() {
        Device apnsDevice = Device.builder().deviceId("ipad-1").siteId("site-1").platform(PushPlatform.APNS).pushToken("ab").build();

        DeviceOutcome outcome = service.deliver(job, apnsDevice, notification());

        assertEquals(DeviceOutcome.FAILED, outcome.getStatus());
        assertEquals(PushErrorCodes.PLATFORM_NOT_CONFIGURED, outcome.getErrorCode());
    }

    @Test
    void deviceWithoutPlatformUsesDefault() {
        Device legacy = Device.builder().deviceId("pos-2").siteId("site-1").pushToken("t").build();

        DeviceOutcome outcome = service.deliver(job, legacy, notification());

        assertEquals("fcm", outcome.getPlatform());
        assertEquals(PushErrorCodes.PLATFORM_NOT_CONFIGURED, outcome.getErrorCode());
    }

    @Test
    void expiredNotificationIsNotSent() {
        PushNotification notification = notification();
        clock.advance(Duration.ofSeconds(301));

        DeviceOutcome outcome = service.deliver(job, wnsDevice(), notification);

        assertEquals(PushErrorCodes.NOTIFICATION_EXPIRED, outcome.getErrorCode());
        verify(wns, never()).sendNotification(anyString(), any(NotificationPayload.class));
        ArgumentCaptor<PushNotificationLog> logged = ArgumentCaptor.forClass(PushNotificationLog.class);
        verify(logRepository).save(logged.capture());
        assertEquals(PushDeliveryStatus.EXPIRED, logged.getValue().getStatus());
    }

    @Test
    void directSendToUnconfiguredPlatformThrows() {
        NotificationPayload payload = NotificationPayload.builder().title("t").body("b").createdAt(clock.instant()).build();

        assertThrows(PlatformUnavailableException.class, () -> service.sendDirect(PushPlatform.MQTT, "devices/x", payload));
    }
}
