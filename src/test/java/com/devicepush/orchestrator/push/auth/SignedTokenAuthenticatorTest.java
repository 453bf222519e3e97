package com.devicepush.orchestrator.push.auth;

import com.devicepush.orchestrator.MutableClock;
import com.devicepush.orchestrator.push.PushConfigurationException;
import com.eatthepath.pushy.apns.auth.ApnsSigningKey;
import com.eatthepath.pushy.apns.auth.ApnsVerificationKey;
import com.eatthepath.pushy.apns.auth.AuthenticationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignedTokenAuthenticatorTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private KeyPair keyPair;
    private MutableClock clock;
    private SignedTokenAuthenticator authenticator;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        keyPair = generator.generateKeyPair();
        clock = new MutableClock(START);
        authenticator = new SignedTokenAuthenticator(
                new ApnsSigningKey("KEY123", "TEAM456", (ECPrivateKey) keyPair.getPrivate()), clock, 300);
    }

    @Test
    void tokenIsReusedUntilBufferThenReissued() {
        String first = authenticator.getAuthHeader().get("authorization");

        clock.advance(Duration.ofMinutes(50));
        String second = authenticator.getAuthHeader().get("authorization");
        assertEquals(first, second);

        clock.advance(Duration.ofMinutes(6));
        String third = authenticator.getAuthHeader().get("authorization");
        assertNotEquals(first, third);
    }

    @Test
    void tokenIsVerifiableWithMatchingKey() throws Exception {
        String header = authenticator.getAuthHeader().get("authorization");
        assertTrue(header.startsWith("bearer "));

        AuthenticationToken token = new AuthenticationToken(header.substring("bearer ".length()));
        assertEquals("KEY123", token.getKeyId());
        assertEquals("TEAM456", token.getTeamId());
        assertEquals(START, token.getIssuedAt());
        assertTrue(token.verifySignature(new ApnsVerificationKey("KEY123", "TEAM456", (ECPublicKey) keyPair.getPublic())));
    }

    @Test
    void tokenValidityFollowsIssueTime() {
        authenticator.refreshToken();

        assertTrue(authenticator.isTokenValid(300));
        clock.advance(SignedTokenAuthenticator.TOKEN_VALIDITY.minusMinutes(4));
        assertFalse(authenticator.isTokenValid(300));
        assertTrue(authenticator.isTokenValid(0));
    }

    @Test
    void missingTeamIdFailsFast() {
        assertThrows(PushConfigurationException.class,
                () -> new SignedTokenAuthenticator(new ApnsSigningKey("KEY123", " ", (ECPrivateKey) keyPair.getPrivate()), clock, 300));
    }

    @Test
    void missingKeyFileFailsFast() {
        assertThrows(PushConfigurationException.class,
                () -> SignedTokenAuthenticator.fromPkcs8File("/does/not/exist.p8", "KEY123", "TEAM456", clock, 300));
    }
}
