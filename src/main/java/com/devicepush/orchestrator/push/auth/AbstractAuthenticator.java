package com.devicepush.orchestrator.push.auth;

import com.devicepush.orchestrator.push.PushConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Token cache shared by every authenticator. The token and its expiry are swapped as one immutable value so
 * readers never observe a token paired with another token's expiry.
 */
public abstract class AbstractAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(AbstractAuthenticator.class);

    protected final Clock clock;
    private final long refreshBufferSeconds;
    private volatile CachedToken cachedToken;

    protected AbstractAuthenticator(Clock clock, long refreshBufferSeconds) {
        if (refreshBufferSeconds < 0) {
            throw new IllegalArgumentException("Refresh buffer must not be negative");
        }
        this.clock = clock;
        this.refreshBufferSeconds = refreshBufferSeconds;
    }

    @Override
    public boolean isTokenValid(long bufferSeconds) {
        CachedToken token = cachedToken;
        if (token == null) {
            return false;
        }
        return clock.instant().isBefore(token.expiresAt().minusSeconds(bufferSeconds));
    }

    @Override
    public void ensureValidToken() {
        if (isTokenValid(refreshBufferSeconds)) {
            return;
        }
        log.debug("AUTH_REFRESH - Token missing or near expiry, refreshing [type={}]", type());
        if (!refreshToken()) {
            log.warn("AUTH_REFRESH_FAILED - Could not refresh token [type={}]", type());
        }
    }

    protected String requireToken() {
        ensureValidToken();
        CachedToken token = cachedToken;
        if (token == null || !isTokenValid(0)) {
            throw new PushAuthenticationException("No valid " + type() + " token available");
        }
        return token.value();
    }

    protected void storeToken(String value, Instant expiresAt) {
        this.cachedToken = new CachedToken(value, expiresAt);
    }

    static String requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new PushConfigurationException(name + " is required");
        }
        return value;
    }

    private record CachedToken(String value, Instant expiresAt) {
    }
}
