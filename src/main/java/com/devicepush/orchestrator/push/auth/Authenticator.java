package com.devicepush.orchestrator.push.auth;

import java.util.Map;

/**
 * Produces the credential a provider attaches to outgoing requests.
 *
 * <p>Implementations cache a single token and refresh it before it enters the safety buffer that precedes its
 * expiry. Concurrent refreshes may both hit the upstream; the last one written wins and both tokens are valid.
 */
public interface Authenticator {

    long DEFAULT_REFRESH_BUFFER_SECONDS = 300;

    AuthenticationType type();

    /**
     * Returns the headers to attach to a request, refreshing the cached token first when needed.
     *
     * @throws PushAuthenticationException when no valid token can be obtained
     */
    Map<String, String> getAuthHeader();

    /**
     * Obtains a new token from the issuer. Never throws; failures are logged and reported as {@code false}.
     */
    boolean refreshToken();

    /**
     * A token is valid only while {@code now < expiry - bufferSeconds}.
     */
    boolean isTokenValid(long bufferSeconds);

    default boolean isTokenValid() {
        return isTokenValid(DEFAULT_REFRESH_BUFFER_SECONDS);
    }

    /**
     * Refreshes when the cached token is missing or inside the configured buffer.
     */
    void ensureValidToken();
}
