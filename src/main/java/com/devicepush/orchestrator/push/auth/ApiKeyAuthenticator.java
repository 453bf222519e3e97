package com.devicepush.orchestrator.push.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Static credential. The key is treated as valid for a year and refreshing is a no-op.
 */
public class ApiKeyAuthenticator extends AbstractAuthenticator {

    public static final String DEFAULT_HEADER_NAME = "Authorization";
    public static final String DEFAULT_HEADER_PREFIX = "key=";
    static final Duration KEY_HORIZON = Duration.ofDays(365);

    private final String apiKey;
    private final String headerName;
    private final String headerPrefix;

    public ApiKeyAuthenticator(String apiKey, Clock clock) {
        this(apiKey, DEFAULT_HEADER_NAME, DEFAULT_HEADER_PREFIX, clock);
    }

    public ApiKeyAuthenticator(String apiKey, String headerName, String headerPrefix, Clock clock) {
        super(clock, DEFAULT_REFRESH_BUFFER_SECONDS);
        this.apiKey = requireSetting(apiKey, "API key");
        this.headerName = headerName == null || headerName.isBlank() ? DEFAULT_HEADER_NAME : headerName;
        this.headerPrefix = headerPrefix == null ? "" : headerPrefix;
        storeToken(this.apiKey, clock.instant().plus(KEY_HORIZON));
    }

    @Override
    public AuthenticationType type() {
        return AuthenticationType.API_KEY;
    }

    @Override
    public Map<String, String> getAuthHeader() {
        return Map.of(headerName, headerPrefix + apiKey);
    }

    @Override
    public boolean refreshToken() {
        return true;
    }

    public String getApiKey() {
        return apiKey;
    }
}
