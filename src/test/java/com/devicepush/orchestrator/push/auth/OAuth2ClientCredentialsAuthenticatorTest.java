package com.devicepush.orchestrator.push.auth;

import com.devicepush.orchestrator.MutableClock;
import com.devicepush.orchestrator.push.PushConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OAuth2ClientCredentialsAuthenticatorTest {

    private static final String TOKEN_URL = "https://login.example.com/accesstoken.srf";

    private MockRestServiceServer server;
    private MutableClock clock;
    private OAuth2ClientCredentialsAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        authenticator = new OAuth2ClientCredentialsAuthenticator("client", "secret", TOKEN_URL, "notify.windows.com",
                builder.build(), clock, 300);
    }

    @Test
    void refreshPostsClientCredentialsForm() {
        server.expect(requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of(
                        "grant_type", "client_credentials",
                        "client_id", "client",
                        "scope", "notify.windows.com")))
                .andRespond(withSuccess("{\"access_token\":\"abc\",\"token_type\":\"bearer\",\"expires_in\":86400}", MediaType.APPLICATION_JSON));

        assertTrue(authenticator.refreshToken());
        assertEquals("Bearer abc", authenticator.getAuthHeader().get("Authorization"));
        server.verify();
    }

    @Test
    void missingExpiresInDefaultsToOneHour() {
        server.expect(requestTo(TOKEN_URL))
                .andRespond(withSuccess("{\"access_token\":\"abc\"}", MediaType.APPLICATION_JSON));

        assertTrue(authenticator.refreshToken());
        assertTrue(authenticator.isTokenValid(300));

        clock.advance(Duration.ofSeconds(3300));
        assertFalse(authenticator.isTokenValid(300));
    }

    @Test
    void rejectedRequestReturnsFalse() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertFalse(authenticator.refreshToken());
        assertFalse(authenticator.isTokenValid(0));
    }

    @Test
    void missingClientSecretFailsFast() {
        assertThrows(PushConfigurationException.class, () -> new OAuth2ClientCredentialsAuthenticator(
                "client", "", TOKEN_URL, null, RestClient.create(), clock, 300));
    }
}
