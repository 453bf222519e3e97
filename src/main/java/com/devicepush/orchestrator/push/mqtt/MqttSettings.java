package com.devicepush.orchestrator.push.mqtt;

/**
 * Broker connection settings, resolved from {@code push.mqtt.*}.
 */
public record MqttSettings(String brokerUri,
                           String clientId,
                           String username,
                           int qos,
                           boolean retain,
                           int keepAliveSeconds,
                           int connectionTimeoutSeconds) {
}
