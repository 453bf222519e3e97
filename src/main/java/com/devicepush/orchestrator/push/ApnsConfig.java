package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.apns.ApnsDeliveryProvider;
import com.devicepush.orchestrator.push.auth.SignedTokenAuthenticator;
import com.eatthepath.pushy.apns.ApnsClient;
import com.eatthepath.pushy.apns.ApnsClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(prefix = "push.apns", name = "enabled", havingValue = "true")
public class ApnsConfig {

    private static final Logger log = LoggerFactory.getLogger(ApnsConfig.class);

    @Bean
    public SignedTokenAuthenticator apnsAuthenticator(
            @Value("${push.apns.team-id:}") String teamId,
            @Value("${push.apns.key-id:}") String keyId,
            @Value("${push.apns.auth-key-path:}") String authKeyPath,
            @Value("${push.auth.refresh-buffer-seconds:300}") long refreshBufferSeconds,
            Clock clock
    ) {
        log.info("Loading APNs signing key [keyId={}, teamId={}, path={}]", keyId, teamId, authKeyPath);
        return SignedTokenAuthenticator.fromPkcs8File(authKeyPath, keyId, teamId, clock, refreshBufferSeconds);
    }

    @Bean(destroyMethod = "close")
    public ApnsClient apnsClient(
            SignedTokenAuthenticator apnsAuthenticator,
            @Value("${push.apns.use-sandbox:true}") boolean useSandbox,
            @Value("${push.http.connect-timeout:5s}") Duration connectTimeout
    ) throws Exception {
        String host = useSandbox ? ApnsClientBuilder.DEVELOPMENT_APNS_HOST : ApnsClientBuilder.PRODUCTION_APNS_HOST;
        log.info("Building APNs client [host={}]", host);
        return new ApnsClientBuilder()
                .setApnsServer(host)
                .setSigningKey(apnsAuthenticator.getSigningKey())
                .setConnectionTimeout(connectTimeout)
                .build();
    }

    @Bean
    public ApnsDeliveryProvider apnsDeliveryProvider(
            ApnsClient apnsClient,
            SignedTokenAuthenticator apnsAuthenticator,
            @Value("${push.apns.bundle-id:}") String bundleId,
            @Value("${push.apns.use-sandbox:true}") boolean useSandbox,
            @Value("${push.http.read-timeout:10s}") Duration sendTimeout,
            Clock clock
    ) {
        if (bundleId == null || bundleId.isBlank()) {
            throw new PushConfigurationException("push.apns.bundle-id is required");
        }
        log.info("APNs provider configured [bundleId={}, sandbox={}]", bundleId, useSandbox);
        return new ApnsDeliveryProvider(apnsClient, apnsAuthenticator, bundleId, useSandbox, sendTimeout, clock);
    }
}
