package com.devicepush.orchestrator.push.auth;

import com.devicepush.orchestrator.push.PushConfigurationException;
import com.eatthepath.pushy.apns.auth.ApnsSigningKey;
import com.eatthepath.pushy.apns.auth.AuthenticationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Issues ES256 provider tokens from an APNs signing key. Signing is local, so refresh never touches the network.
 */
public class SignedTokenAuthenticator extends AbstractAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SignedTokenAuthenticator.class);
    static final Duration TOKEN_VALIDITY = Duration.ofHours(1);

    private final ApnsSigningKey signingKey;

    public SignedTokenAuthenticator(ApnsSigningKey signingKey, Clock clock, long refreshBufferSeconds) {
        super(clock, refreshBufferSeconds);
        if (signingKey == null) {
            throw new PushConfigurationException("Signing key is required");
        }
        requireSetting(signingKey.getKeyId(), "Signing key id");
        requireSetting(signingKey.getTeamId(), "Team id");
        this.signingKey = signingKey;
    }

    /**
     * Loads a PKCS#8 {@code .p8} key as issued by Apple.
     */
    public static SignedTokenAuthenticator fromPkcs8File(String path, String keyId, String teamId,
                                                         Clock clock, long refreshBufferSeconds) {
        requireSetting(path, "Signing key path");
        requireSetting(keyId, "Signing key id");
        requireSetting(teamId, "Team id");
        try {
            ApnsSigningKey key = ApnsSigningKey.loadFromPkcs8File(new File(path), teamId, keyId);
            return new SignedTokenAuthenticator(key, clock, refreshBufferSeconds);
        } catch (IOException | GeneralSecurityException e) {
            throw new PushConfigurationException("Unable to load signing key from " + path, e);
        }
    }

    public ApnsSigningKey getSigningKey() {
        return signingKey;
    }

    @Override
    public AuthenticationType type() {
        return AuthenticationType.SIGNED_TOKEN;
    }

    @Override
    public Map<String, String> getAuthHeader() {
        return Map.of("authorization", requireToken());
    }

    @Override
    public boolean refreshToken() {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(TOKEN_VALIDITY);
        try {
            AuthenticationToken token = new AuthenticationToken(signingKey, issuedAt);
            storeToken(token.getAuthorizationHeader().toString(), expiresAt);
            log.info("SIGNED_TOKEN_ISSUED - New signed token issued [keyId={}, teamId={}, expiresAt={}]",
                    signingKey.getKeyId(), signingKey.getTeamId(), expiresAt);
            return true;
        } catch (RuntimeException e) {
            log.error("SIGNED_TOKEN_FAILED - Could not sign token [keyId={}, error={}]", signingKey.getKeyId(), e.getMessage());
            return false;
        }
    }
}
