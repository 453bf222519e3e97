package com.devicepush.orchestrator.push.auth;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthenticatorValidityTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    /**
     * Test double whose token expiry is set directly.
     */
    static class FixedExpiryAuthenticator extends AbstractAuthenticator {
        int refreshes;
        Instant nextExpiry;

        FixedExpiryAuthenticator(Clock clock, Instant expiry) {
            super(clock, 300);
            this.nextExpiry = expiry;
        }

        @Override
        public AuthenticationType type() {
            return AuthenticationType.API_KEY;
        }

        @Override
        public Map<String, String> getAuthHeader() {
            return Map.of("Authorization", requireToken());
        }

        @Override
        public boolean refreshToken() {
            refreshes++;
            storeToken("token-" + refreshes, nextExpiry);
            return true;
        }
    }

    @Test
    void noTokenIsNeverValid() {
        FixedExpiryAuthenticator auth = new FixedExpiryAuthenticator(Clock.fixed(NOW, ZoneOffset.UTC), NOW.plusSeconds(3600));

        assertFalse(auth.isTokenValid(0));
        assertFalse(auth.isTokenValid());
    }

    @Test
    void validityRespectsBufferBoundary() {
        Instant expiry = NOW.plusSeconds(1000);
        for (long offset : new long[]{0, 1, 699, 700, 701, 999, 1000, 1001}) {
            Clock clock = Clock.fixed(NOW.plusSeconds(offset), ZoneOffset.UTC);
            FixedExpiryAuthenticator auth = new FixedExpiryAuthenticator(clock, expiry);
            auth.refreshToken();

            boolean expected = NOW.plusSeconds(offset).isBefore(expiry.minusSeconds(300));
            assertEquals(expected, auth.isTokenValid(300), "offset " + offset);
        }
    }

    @Test
    void ensureValidTokenRefreshesOnlyInsideBuffer() {
        FixedExpiryAuthenticator auth = new FixedExpiryAuthenticator(Clock.fixed(NOW, ZoneOffset.UTC), NOW.plusSeconds(3600));

        auth.ensureValidToken();
        auth.ensureValidToken();
        assertEquals(1, auth.refreshes);

        auth.nextExpiry = NOW.plusSeconds(200);
        auth.refreshToken();
        auth.ensureValidToken();
        assertEquals(3, auth.refreshes);
    }

    @Test
    void apiKeyIsValidImmediatelyAndRefreshIsNoop() {
        ApiKeyAuthenticator auth = new ApiKeyAuthenticator("secret", Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(auth.isTokenValid());
        assertTrue(auth.refreshToken());
        assertEquals(Map.of("Authorization", "key=secret"), auth.getAuthHeader());
    }

    @Test
    void apiKeyUsesCustomHeader() {
        ApiKeyAuthenticator auth = new ApiKeyAuthenticator("abc", "X-Api-Key", "", Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(Map.of("X-Api-Key", "abc"), auth.getAuthHeader());
    }
}
