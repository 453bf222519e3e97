package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.OAuth2ClientCredentialsAuthenticator;
import com.devicepush.orchestrator.push.wns.WnsDeliveryProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(prefix = "push.wns", name = "enabled", havingValue = "true")
public class WnsConfig {

    @Bean
    public RestClient wnsRestClient(@Value("${push.http.connect-timeout:5s}") Duration connectTimeout,
                                    @Value("${push.http.read-timeout:10s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder().requestFactory(requestFactory).build();
    }

    @Bean
    public OAuth2ClientCredentialsAuthenticator wnsAuthenticator(
            RestClient wnsRestClient,
            @Value("${push.wns.client-id:}") String clientId,
            @Value("${push.wns.client-secret:}") String clientSecret,
            @Value("${push.wns.token-url:https://login.live.com/accesstoken.srf}") String tokenUrl,
            @Value("${push.wns.scope:notify.windows.com}") String scope,
            @Value("${push.auth.refresh-buffer-seconds:300}") long refreshBufferSeconds,
            Clock clock
    ) {
        return new OAuth2ClientCredentialsAuthenticator(clientId, clientSecret, tokenUrl, scope, wnsRestClient, clock, refreshBufferSeconds);
    }

    @Bean
    public WnsDeliveryProvider wnsDeliveryProvider(RestClient wnsRestClient,
                                                   OAuth2ClientCredentialsAuthenticator wnsAuthenticator,
                                                   @Value("${push.wns.batch-size:100}") int batchSize,
                                                   ObjectMapper objectMapper,
                                                   Clock clock) {
        return new WnsDeliveryProvider(wnsRestClient, wnsAuthenticator, objectMapper, batchSize, clock);
    }
}
