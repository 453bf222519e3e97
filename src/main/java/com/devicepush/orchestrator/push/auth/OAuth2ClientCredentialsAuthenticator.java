package com.devicepush.orchestrator.push.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.Map;

/**
 * OAuth2 client-credentials grant against a token endpoint. Used for WNS.
 */
public class OAuth2ClientCredentialsAuthenticator extends AbstractAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(OAuth2ClientCredentialsAuthenticator.class);
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String clientId;
    private final String clientSecret;
    private final String tokenUrl;
    private final String scope;
    private final RestClient restClient;

    public OAuth2ClientCredentialsAuthenticator(String clientId, String clientSecret, String tokenUrl, String scope,
                                                RestClient restClient, Clock clock, long refreshBufferSeconds) {
        super(clock, refreshBufferSeconds);
        this.clientId = requireSetting(clientId, "OAuth2 client id");
        this.clientSecret = requireSetting(clientSecret, "OAuth2 client secret");
        this.tokenUrl = requireSetting(tokenUrl, "OAuth2 token url");
        this.scope = scope;
        this.restClient = restClient;
    }

    @Override
    public AuthenticationType type() {
        return AuthenticationType.OAUTH2_CLIENT_CREDENTIALS;
    }

    @Override
    public Map<String, String> getAuthHeader() {
        return Map.of("Authorization", "Bearer " + requireToken());
    }

    @Override
    public boolean refreshToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        if (scope != null && !scope.isBlank()) {
            form.add("scope", scope);
        }
        try {
            TokenResponse response = restClient.post()
                    .uri(tokenUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TokenResponse.class);
            if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
                log.error("OAUTH2_TOKEN_MISSING - Token endpoint returned no access_token [tokenUrl={}]", tokenUrl);
                return false;
            }
            long expiresIn = response.expiresIn() != null ? response.expiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
            storeToken(response.accessToken(), clock.instant().plusSeconds(expiresIn));
            log.info("OAUTH2_TOKEN_REFRESHED - Access token obtained [tokenUrl={}, expiresIn={}]", tokenUrl, expiresIn);
            return true;
        } catch (RestClientException e) {
            log.error("OAUTH2_TOKEN_FAILED - Token request failed [tokenUrl={}, error={}]", tokenUrl, e.getMessage());
            return false;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(@JsonProperty("access_token") String accessToken,
                         @JsonProperty("token_type") String tokenType,
                         @JsonProperty("expires_in") Long expiresIn) {
    }
}
