package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.ApiKeyAuthenticator;
import com.devicepush.orchestrator.push.webpush.WebPushDeliveryProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "push.web-push", name = "enabled", havingValue = "true")
public class WebPushConfig {

    @Bean
    public WebPushDeliveryProvider webPushDeliveryProvider(
            @Value("${push.web-push.vapid-public-key:}") String vapidPublicKey,
            @Value("${push.web-push.vapid-private-key:}") String vapidPrivateKey,
            @Value("${push.web-push.subject:}") String subject,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        ApiKeyAuthenticator vapidKey = new ApiKeyAuthenticator(vapidPrivateKey, "Authorization", "vapid k=", clock);
        return new WebPushDeliveryProvider(vapidKey, vapidPublicKey, subject, objectMapper, clock);
    }
}
