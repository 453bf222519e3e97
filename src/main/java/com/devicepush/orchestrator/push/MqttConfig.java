package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.ApiKeyAuthenticator;
import com.devicepush.orchestrator.push.mqtt.MqttDeliveryProvider;
import com.devicepush.orchestrator.push.mqtt.MqttSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
@ConditionalOnProperty(prefix = "push.mqtt", name = "enabled", havingValue = "true")
public class MqttConfig {

    @Bean
    public MqttDeliveryProvider mqttDeliveryProvider(
            @Value("${push.mqtt.host:localhost}") String host,
            @Value("${push.mqtt.use-tls:false}") boolean useTls,
            @Value("${push.mqtt.port:0}") int port,
            @Value("${push.mqtt.client-id:}") String clientId,
            @Value("${push.mqtt.username:}") String username,
            @Value("${push.mqtt.password:}") String password,
            @Value("${push.mqtt.qos:1}") int qos,
            @Value("${push.mqtt.retain:false}") boolean retain,
            @Value("${push.mqtt.keep-alive-seconds:60}") int keepAliveSeconds,
            @Value("${push.mqtt.connection-timeout-seconds:10}") int connectionTimeoutSeconds,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        if (username == null || username.isBlank()) {
            throw new PushConfigurationException("push.mqtt.username is required");
        }
        int brokerPort = port > 0 ? port : (useTls ? 8883 : 1883);
        String brokerUri = (useTls ? "ssl://" : "tcp://") + host + ":" + brokerPort;
        String resolvedClientId = clientId == null || clientId.isBlank()
                ? "orchestrator-" + UUID.randomUUID().toString().substring(0, 8)
                : clientId;
        MqttSettings settings = new MqttSettings(brokerUri, resolvedClientId, username, qos, retain, keepAliveSeconds, connectionTimeoutSeconds);
        return new MqttDeliveryProvider(settings, new ApiKeyAuthenticator(password, "Authorization", "", clock), objectMapper, clock);
    }
}
