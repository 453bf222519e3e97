package com.devicepush.orchestrator.push.auth;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.devicepush.orchestrator.push.PushConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Delegates token issuance to a Google service-account credential. Used for FCM.
 */
public class ServiceAccountAuthenticator extends AbstractAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ServiceAccountAuthenticator.class);
    static final Duration DEFAULT_VALIDITY = Duration.ofHours(1);

    private final GoogleCredentials credentials;

    public ServiceAccountAuthenticator(GoogleCredentials credentials, Clock clock, long refreshBufferSeconds) {
        super(clock, refreshBufferSeconds);
        if (credentials == null) {
            throw new PushConfigurationException("Service account credentials are required");
        }
        this.credentials = credentials;
    }

    @Override
    public AuthenticationType type() {
        return AuthenticationType.SERVICE_ACCOUNT;
    }

    @Override
    public Map<String, String> getAuthHeader() {
        return Map.of("Authorization", "Bearer " + requireToken());
    }

    @Override
    public boolean refreshToken() {
        try {
            credentials.refresh();
            AccessToken accessToken = credentials.getAccessToken();
            if (accessToken == null || accessToken.getTokenValue() == null) {
                log.error("SERVICE_ACCOUNT_TOKEN_MISSING - Credential refresh produced no access token");
                return false;
            }
            Instant expiresAt = accessToken.getExpirationTime() != null
                    ? accessToken.getExpirationTime().toInstant()
                    : clock.instant().plus(DEFAULT_VALIDITY);
            storeToken(accessToken.getTokenValue(), expiresAt);
            log.info("SERVICE_ACCOUNT_TOKEN_REFRESHED - Access token refreshed [expiresAt={}]", expiresAt);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("SERVICE_ACCOUNT_TOKEN_FAILED - Credential refresh failed [error={}]", e.getMessage());
            return false;
        }
    }
}
