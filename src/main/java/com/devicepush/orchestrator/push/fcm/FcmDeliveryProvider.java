package com.devicepush.orchestrator.push.fcm;

import com.devicepush.orchestrator.push.AbstractDeliveryProvider;
import com.devicepush.orchestrator.push.DeviceNotification;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.auth.Authenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.firebase.messaging.AndroidConfig;
import com.google.firebase.messaging.BatchResponse;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.MessagingErrorCode;
import com.google.firebase.messaging.Notification;
import com.google.firebase.messaging.SendResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Mobile push through Firebase Cloud Messaging.
 */
public class FcmDeliveryProvider extends AbstractDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(FcmDeliveryProvider.class);

    static final int MAX_PAYLOAD_BYTES = 4096;
    static final int MAX_BATCH_SIZE = 500;
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9_:\\-]{140,170}");
    private static final Pattern TOPIC_PATTERN = Pattern.compile("[A-Za-z0-9\\-_.~%]{1,900}");

    private final FirebaseMessaging firebaseMessaging;
    private final ObjectMapper objectMapper;
    private final String projectId;

    public FcmDeliveryProvider(FirebaseMessaging firebaseMessaging, Authenticator authenticator,
                               ObjectMapper objectMapper, String projectId, Clock clock) {
        super(authenticator, clock);
        this.firebaseMessaging = firebaseMessaging;
        this.objectMapper = objectMapper;
        this.projectId = projectId;
    }

    @Override
    public PushPlatform platform() {
        return PushPlatform.FCM;
    }

    @Override
    protected boolean doInitialize() {
        if (!authenticator().refreshToken()) {
            log.error("FCM_INIT_FAILED - Service account token could not be obtained [projectId={}]", projectId);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateDeviceToken(String deviceToken) {
        return deviceToken != null && TOKEN_PATTERN.matcher(deviceToken).matches();
    }

    @Override
    protected ProviderResult doSend(String deviceToken, NotificationPayload payload) {
        int size = payloadSize(payload);
        if (size > MAX_PAYLOAD_BYTES) {
            return payloadTooLarge(size);
        }
        authenticator().ensureValidToken();
        try {
            String id = firebaseMessaging.send(buildMessage(payload).setToken(deviceToken).build());
            return ProviderResult.sent(platform(), id);
        } catch (FirebaseMessagingException e) {
            return fromFirebaseException(e);
        }
    }

    /**
     * Uses the native batch API. Tokens that fail validation are answered locally and never sent.
     */
    @Override
    public List<ProviderResult> sendBulkNotifications(List<DeviceNotification> notifications) {
        ProviderResult[] results = new ProviderResult[notifications.size()];
        List<Integer> indexes = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < notifications.size(); i++) {
            DeviceNotification notification = notifications.get(i);
            if (!validateDeviceToken(notification.deviceToken())) {
                results[i] = record(ProviderResult.failed(platform(), PushErrorCodes.INVALID_TOKEN, "Invalid device token for fcm"));
                continue;
            }
            int size = payloadSize(notification.payload());
            if (size > MAX_PAYLOAD_BYTES) {
                results[i] = record(payloadTooLarge(size));
                continue;
            }
            indexes.add(i);
            messages.add(buildMessage(notification.payload()).setToken(notification.deviceToken()).build());
        }
        if (!messages.isEmpty() && !initialize()) {
            indexes.forEach(i -> results[i] = record(ProviderResult.failed(platform(), PushErrorCodes.NOT_INITIALIZED, "FCM provider is not initialized")));
            return Arrays.asList(results);
        }
        for (int start = 0; start < messages.size(); start += MAX_BATCH_SIZE) {
            int end = Math.min(start + MAX_BATCH_SIZE, messages.size());
            sendChunk(messages.subList(start, end), indexes.subList(start, end), results);
        }
        return Arrays.asList(results);
    }

    private void sendChunk(List<Message> chunk, List<Integer> chunkIndexes, ProviderResult[] results) {
        try {
            authenticator().ensureValidToken();
            BatchResponse batch = firebaseMessaging.sendEach(chunk);
            List<SendResponse> responses = batch.getResponses();
            for (int j = 0; j < responses.size(); j++) {
                SendResponse response = responses.get(j);
                results[chunkIndexes.get(j)] = record(response.isSuccessful()
                        ? ProviderResult.sent(platform(), response.getMessageId())
                        : fromFirebaseException(response.getException()));
            }
            log.info("FCM_BATCH_SENT - Batch delivered [size={}, success={}, failure={}]", chunk.size(), batch.getSuccessCount(), batch.getFailureCount());
        } catch (FirebaseMessagingException e) {
            log.error("FCM_BATCH_FAILED - Batch request failed [size={}, error={}]", chunk.size(), e.getMessage());
            ProviderResult failure = fromFirebaseException(e);
            chunkIndexes.forEach(i -> results[i] = record(failure));
        } catch (RuntimeException e) {
            log.error("FCM_BATCH_ERROR - Unexpected batch failure [size={}, error={}]", chunk.size(), e.getMessage(), e);
            chunkIndexes.forEach(i -> results[i] = record(ProviderResult.failed(platform(), PushErrorCodes.FCM_ERROR, e.getMessage())));
        }
    }

    @Override
    public ProviderResult sendTopicNotification(String topic, NotificationPayload payload) {
        if (topic == null || !TOPIC_PATTERN.matcher(topic).matches()) {
            return record(ProviderResult.failed(platform(), PushErrorCodes.INVALID_TOPIC, "Invalid FCM topic name"));
        }
        if (!initialize()) {
            return record(ProviderResult.failed(platform(), PushErrorCodes.NOT_INITIALIZED, "FCM provider is not initialized"));
        }
        try {
            authenticator().ensureValidToken();
            String id = firebaseMessaging.send(buildMessage(payload).setTopic(topic).build());
            log.info("FCM_TOPIC_SENT - Topic notification accepted [topic={}, messageId={}]", topic, id);
            return record(ProviderResult.sent(platform(), id));
        } catch (FirebaseMessagingException e) {
            return record(fromFirebaseException(e));
        } catch (RuntimeException e) {
            log.error("FCM_TOPIC_ERROR - Topic send failed [topic={}, error={}]", topic, e.getMessage(), e);
            return record(ProviderResult.failed(platform(), PushErrorCodes.FCM_ERROR, e.getMessage()));
        }
    }

    private Message.Builder buildMessage(NotificationPayload payload) {
        AndroidConfig.Builder android = AndroidConfig.builder()
                .setTtl(payload.getTtlSeconds() * 1000L)
                .setPriority(payload.getPriority().isUrgent() ? AndroidConfig.Priority.HIGH : AndroidConfig.Priority.NORMAL);
        if (payload.getCollapseKey() != null) {
            android.setCollapseKey(payload.getCollapseKey());
        }
        return Message.builder()
                .setNotification(Notification.builder()
                        .setTitle(payload.getTitle())
                        .setBody(payload.getBody())
                        .build())
                .putAllData(payload.getData())
                .setAndroidConfig(android.build());
    }

    private int payloadSize(NotificationPayload payload) {
        Map<String, Object> estimate = new LinkedHashMap<>();
        estimate.put("title", payload.getTitle());
        estimate.put("body", payload.getBody());
        estimate.put("data", payload.getData());
        try {
            return objectMapper.writeValueAsString(estimate).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize FCM payload", e);
        }
    }

    private ProviderResult fromFirebaseException(FirebaseMessagingException e) {
        MessagingErrorCode code = e != null ? e.getMessagingErrorCode() : null;
        String errorCode;
        if (code == null) {
            errorCode = PushErrorCodes.FCM_ERROR;
        } else {
            errorCode = switch (code) {
                case UNREGISTERED -> PushErrorCodes.UNREGISTERED;
                case INVALID_ARGUMENT -> PushErrorCodes.INVALID_TOKEN;
                case SENDER_ID_MISMATCH -> PushErrorCodes.FORBIDDEN;
                case QUOTA_EXCEEDED -> PushErrorCodes.QUOTA_EXCEEDED;
                case THIRD_PARTY_AUTH_ERROR -> PushErrorCodes.UNAUTHORIZED;
                case UNAVAILABLE -> PushErrorCodes.SERVICE_UNAVAILABLE;
                case INTERNAL -> PushErrorCodes.SERVER_ERROR;
                default -> PushErrorCodes.FCM_ERROR;
            };
        }
        return ProviderResult.failed(platform(), errorCode, e != null ? e.getMessage() : "FCM send failed");
    }

    @Override
    protected int maxPayloadBytes() {
        return MAX_PAYLOAD_BYTES;
    }

    @Override
    protected boolean supportsTopics() {
        return true;
    }

    @Override
    protected String genericErrorCode() {
        return PushErrorCodes.FCM_ERROR;
    }

    @Override
    protected Map<String, Object> platformDetails() {
        return Map.of("project_id", projectId == null ? "" : projectId, "max_batch_size", MAX_BATCH_SIZE);
    }
}
