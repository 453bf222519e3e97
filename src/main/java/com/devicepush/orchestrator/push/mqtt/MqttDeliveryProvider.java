package com.devicepush.orchestrator.push.mqtt;

import com.devicepush.orchestrator.push.AbstractDeliveryProvider;
import com.devicepush.orchestrator.push.NotificationPayload;
import com.devicepush.orchestrator.push.ProviderResult;
import com.devicepush.orchestrator.push.PushConfigurationException;
import com.devicepush.orchestrator.push.PushErrorCodes;
import com.devicepush.orchestrator.push.PushPlatform;
import com.devicepush.orchestrator.push.auth.ApiKeyAuthenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes notifications to an MQTT broker. The device token is the topic the device subscribes to.
 */
public class MqttDeliveryProvider extends AbstractDeliveryProvider {

    private static final Logger log = LoggerFactory.getLogger(MqttDeliveryProvider.class);

    static final int MAX_PAYLOAD_BYTES = 256 * 1024;
    static final int MAX_TOPIC_LENGTH = 256;

    private final MqttSettings settings;
    private final ApiKeyAuthenticator passwordAuthenticator;
    private final ObjectMapper objectMapper;
    private volatile IMqttClient client;

    public MqttDeliveryProvider(MqttSettings settings, ApiKeyAuthenticator passwordAuthenticator,
                                ObjectMapper objectMapper, Clock clock) {
        super(passwordAuthenticator, clock);
        if (settings.qos() < 0 || settings.qos() > 2) {
            throw new PushConfigurationException("MQTT QoS must be 0, 1 or 2");
        }
        if (settings.brokerUri() == null || settings.brokerUri().isBlank()) {
            throw new PushConfigurationException("MQTT broker uri is required");
        }
        this.settings = settings;
        this.passwordAuthenticator = passwordAuthenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    public PushPlatform platform() {
        return PushPlatform.MQTT;
    }

    @Override
    protected boolean doInitialize() {
        try {
            IMqttClient mqttClient = createClient();
            mqttClient.connect(connectOptions());
            this.client = mqttClient;
            log.info("MQTT_CONNECTED - Connected to broker [broker={}, clientId={}]", settings.brokerUri(), settings.clientId());
            return true;
        } catch (MqttException e) {
            log.error("MQTT_CONNECT_FAILED - Could not connect to broker [broker={}, reasonCode={}, error={}]",
                    settings.brokerUri(), e.getReasonCode(), e.getMessage());
            return false;
        }
    }

    protected IMqttClient createClient() throws MqttException {
        return new MqttClient(settings.brokerUri(), settings.clientId(), new MemoryPersistence());
    }

    private MqttConnectOptions connectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setKeepAliveInterval(settings.keepAliveSeconds());
        options.setConnectionTimeout(settings.connectionTimeoutSeconds());
        options.setUserName(settings.username());
        options.setPassword(passwordAuthenticator.getApiKey().toCharArray());
        return options;
    }

    /**
     * Topics are publish targets, so wildcards and empty levels at either end are rejected.
     */
    @Override
    public boolean validateDeviceToken(String topic) {
        return topic != null
                && !topic.isBlank()
                && topic.length() <= MAX_TOPIC_LENGTH
                && !topic.startsWith("/")
                && !topic.endsWith("/")
                && !topic.contains("#")
                && !topic.contains("+");
    }

    @Override
    protected ProviderResult doSend(String topic, NotificationPayload payload) {
        IMqttClient mqttClient = client;
        if (mqttClient == null || !mqttClient.isConnected()) {
            return ProviderResult.failed(platform(), PushErrorCodes.NOT_CONNECTED, "MQTT client is not connected");
        }
        String messageId = payload.getData().getOrDefault("message_id", UUID.randomUUID().toString());
        byte[] body = buildBody(payload, messageId).getBytes(StandardCharsets.UTF_8);
        if (body.length > MAX_PAYLOAD_BYTES) {
            return payloadTooLarge(body.length);
        }
        MqttMessage message = new MqttMessage(body);
        message.setQos(settings.qos());
        message.setRetained(settings.retain());
        try {
            mqttClient.publish(topic, message);
            return ProviderResult.sent(platform(), messageId);
        } catch (MqttException e) {
            return ProviderResult.failed(platform(), PushErrorCodes.MQTT_ERROR_PREFIX + e.getReasonCode(), e.getMessage());
        }
    }

    /**
     * Topic sends are ordinary publishes.
     */
    @Override
    public ProviderResult sendTopicNotification(String topic, NotificationPayload payload) {
        return sendNotification(topic, payload);
    }

    String buildBody(NotificationPayload payload, String messageId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("title", payload.getTitle());
        message.put("body", payload.getBody());
        message.put("timestamp", clock.instant().toString());
        message.put("platform", platform().key());
        message.put("message_id", messageId);
        message.put("data", payload.getData());
        message.put("priority", payload.getPriority().name().toLowerCase(Locale.ROOT));
        message.put("ttl", payload.getTtlSeconds());
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize MQTT message", e);
        }
    }

    @Override
    public void close() {
        IMqttClient mqttClient = client;
        client = null;
        super.close();
        if (mqttClient == null) {
            return;
        }
        try {
            if (mqttClient.isConnected()) {
                mqttClient.disconnect();
            }
            mqttClient.close();
        } catch (MqttException e) {
            log.warn("MQTT_CLOSE_FAILED - Error while closing broker connection [error={}]", e.getMessage());
        }
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
    protected String invalidTokenErrorCode() {
        return PushErrorCodes.INVALID_TOPIC;
    }

    @Override
    protected String genericErrorCode() {
        return PushErrorCodes.MQTT_ERROR_PREFIX + "UNKNOWN";
    }

    @Override
    protected Map<String, Object> platformDetails() {
        IMqttClient mqttClient = client;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("broker", settings.brokerUri());
        details.put("client_id", settings.clientId());
        details.put("qos", settings.qos());
        details.put("connected", mqttClient != null && mqttClient.isConnected());
        return details;
    }
}
