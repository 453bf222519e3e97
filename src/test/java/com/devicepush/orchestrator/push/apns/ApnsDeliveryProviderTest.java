package com.devicepush.orchestrator.push.apns;

import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPriority;
import com.devicepush.orchestrator.push.auth.AuthenticationType;
import com.devicepush.orchestrator.push.auth.Authenticator;
import com.eatthepath.pushy.apns.ApnsClient;
import com.eatthepath.pushy.apns.DeliveryPriority;
import com.eatthepath.pushy.apns.PushNotificationResponse;
import com.eatthepath.pushy.apns.PushType;
import com.eatthepath.pushy.apns.util.SimpleApnsPushNotification;
import com.eatthepath.pushy.apns.util.concurrent.PushNotificationFuture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApnsDeliveryProviderTest {

    private static final String TOKEN = "a1b2c3d4e5f60718293a4b5c6d7e8f90a1b2c3d4e5f60718293a4b5c6d7e8f90";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ApnsClient apnsClient;
    private ApnsDeliveryProvider provider;

    @BeforeEach
    void setUp() {
        apnsClient = mock(ApnsClient.class);
        Authenticator authenticator = mock(Authenticator.class);
        when(authenticator.type()).thenReturn(AuthenticationType.SIGNED_TOKEN);
        when(authenticator.refreshToken()).thenReturn(true);
        provider = new ApnsDeliveryProvider(apnsClient, authenticator, "com.example.pos", true,
                Duration.ofSeconds(2), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private NotificationPayload payload() {
        return NotificationPayload.builder()
                .title("Configuration Update v3")
                .body("New configuration available for pos-7")
                .putData("config_url", "https://cfg/v3.json")
                .priority(PushPriority.HIGH)
                .collapseKey("config-site-1")
                .createdAt(NOW)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static PushNotificationResponse<SimpleApnsPushNotification> response(boolean accepted, int status, String reason) {
        PushNotificationResponse<SimpleApnsPushNotification> response = mock(PushNotificationResponse.class);
        when(response.isAccepted()).thenReturn(accepted);
        when(response.getStatusCode()).thenReturn(status);
        when(response.getRejectionReason()).thenReturn(Optional.ofNullable(reason));
        when(response.getApnsId()).thenReturn(UUID.fromString("4f3c2a10-0000-4000-8000-000000000001"));
        return response;
    }

    private void respondWith(PushNotificationResponse<SimpleApnsPushNotification> response) {
        when(apnsClient.sendNotification(any(SimpleApnsPushNotification.class))).thenAnswer(invocation -> {
            PushNotificationFuture<SimpleApnsPushNotification, PushNotificationResponse<SimpleApnsPushNotification>> future =
                    new PushNotificationFuture<>(invocation.getArgument(0));
            future.complete(response);
            return future;
        });
    }

    @Test
    void acceptsHexAndBase64Tokens() {
        byte[] raw = HexFormat.of().parseHex(TOKEN);

        assertTrue(provider.validateDeviceToken(TOKEN));
        assertTrue(provider.validateDeviceToken(Base64.getEncoder().encodeToString(raw)));
        assertFalse(provider.validateDeviceToken("abc123"));
        assertFalse(provider.validateDeviceToken(null));
    }

    @Test
    void sendsAlertThroughApnsClient() {
        respondWith(response(true, 200, null));

        ProviderResult result = provider.sendNotification(TOKEN, payload());

        assertTrue(result.success());
        assertEquals("4f3c2a10-0000-4000-8000-000000000001", result.messageId());

        ArgumentCaptor<SimpleApnsPushNotification> sent = ArgumentCaptor.forClass(SimpleApnsPushNotification.class);
        verify(apnsClient).sendNotification(sent.capture());
        SimpleApnsPushNotification notification = sent.getValue();
        assertEquals(TOKEN, notification.getToken());
        assertEquals("com.example.pos", notification.getTopic());
        assertEquals(DeliveryPriority.IMMEDIATE, notification.getPriority());
        assertEquals(PushType.ALERT, notification.getPushType());
        assertEquals("config-site-1", notification.getCollapseId());
        assertEquals(NOW.plusSeconds(NotificationPayload.DEFAULT_TTL_SECONDS), notification.getExpiration());
    }

    @Test
    void base64TokenIsSentAsHexAndLowPriorityConservesPower() {
        respondWith(response(true, 200, null));
        String base64 = Base64.getEncoder().encodeToString(HexFormat.of().parseHex(TOKEN));

        provider.sendNotification(base64, payload().toBuilder().priority(PushPriority.LOW).build());

        ArgumentCaptor<SimpleApnsPushNotification> sent = ArgumentCaptor.forClass(SimpleApnsPushNotification.class);
        verify(apnsClient).sendNotification(sent.capture());
        assertEquals(TOKEN, sent.getValue().getToken());
        assertEquals(DeliveryPriority.CONSERVE_POWER, sent.getValue().getPriority());
    }

    @Test
    void unregisteredDeviceIsReported() {
        respondWith(response(false, 410, "Unregistered"));

        ProviderResult result = provider.sendNotification(TOKEN, payload());

        assertFalse(result.success());
        assertEquals(PushErrorCodes.UNREGISTERED, result.errorCode());
    }

    @Test
    void rejectionReasonsMapToErrorCodes() {
        respondWith(response(false, 400, "BadDeviceToken"));
        assertEquals(PushErrorCodes.INVALID_TOKEN, provider.sendNotification(TOKEN, payload()).errorCode());
    }

    @Test
    void expiredProviderTokenMapsToAuthFailure() {
        respondWith(response(false, 403, "ExpiredProviderToken"));
        assertEquals(PushErrorCodes.AUTH_FAILED, provider.sendNotification(TOKEN, payload()).errorCode());
    }

    @Test
    void transportFailureIsReportedAsNetworkError() {
        when(apnsClient.sendNotification(any(SimpleApnsPushNotification.class))).thenAnswer(invocation -> {
            PushNotificationFuture<SimpleApnsPushNotification, PushNotificationResponse<SimpleApnsPushNotification>> future =
                    new PushNotificationFuture<>(invocation.getArgument(0));
            future.completeExceptionally(new IOException("connection reset"));
            return future;
        });

        ProviderResult result = provider.sendNotification(TOKEN, payload());

        assertFalse(result.success());
        assertEquals(PushErrorCodes.NETWORK_ERROR, result.errorCode());
    }

    @Test
    void oversizedPayloadIsNotSent() {
        NotificationPayload large = payload().toBuilder().body("x".repeat(ApnsDeliveryProvider.MAX_PAYLOAD_BYTES)).build();

        assertEquals(PushErrorCodes.PAYLOAD_TOO_LARGE, provider.sendNotification(TOKEN, large).errorCode());
        verify(apnsClient, never()).sendNotification(any(SimpleApnsPushNotification.class));
    }

    @Test
    void payloadContainsAlertAndCustomData() throws Exception {
        JsonNode json = objectMapper.readTree(provider.buildPayload(payload()));

        assertEquals("Configuration Update v3", json.at("/aps/alert/title").asText());
        assertEquals("default", json.at("/aps/sound").asText());
        assertEquals("https://cfg/v3.json", json.get("config_url").asText());
    }

    @Test
    void topicsAreNotSupported() {
        assertEquals(PushErrorCodes.TOPICS_NOT_SUPPORTED, provider.sendTopicNotification("news", payload()).errorCode());
    }
}
