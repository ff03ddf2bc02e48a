package com.p14n.relay.vertx.auth;

import com.p14n.relay.vertx.TestTokens;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtCredentialVerifierTest {

    private final JwtCredentialVerifier verifier = new JwtCredentialVerifier(TestTokens.SECRET);

    @Test
    void shouldReturnIdentityFromClaims() {
        var identity = verifier.verify(TestTokens.token("u1"));

        assertEquals("u1", identity.userId());
        assertEquals("Name of u1", identity.displayName());
        assertNull(identity.avatarRef());
    }

    @Test
    void shouldRejectMissingToken() {
        var e = assertThrows(InvalidCredentialException.class, () -> verifier.verify(" "));
        assertEquals("Authentication required", e.getMessage());
    }

    @Test
    void shouldRejectExpiredToken() {
        var expired = TestTokens.token(TestTokens.SECRET, "u1", "One", -60_000);

        assertThrows(InvalidCredentialException.class, () -> verifier.verify(expired));
    }

    @Test
    void shouldRejectTokenSignedWithAnotherSecret() {
        var forged = TestTokens.token("fedcba9876543210fedcba9876543210", "u1", "One", 60_000);

        assertThrows(InvalidCredentialException.class, () -> verifier.verify(forged));
        assertThrows(InvalidCredentialException.class, () -> verifier.verify("not.a.jwt"));
    }

    @Test
    void shouldRejectTokenWithoutUserId() {
        var anonymous = TestTokens.token(TestTokens.SECRET, null, "One", 60_000);

        assertThrows(InvalidCredentialException.class, () -> verifier.verify(anonymous));
    }

    @Test
    void shouldVerifyTokenSignedWithShortSecret() {
        var secret = "my-nextauth-secret";
        var shortVerifier = new JwtCredentialVerifier(secret);

        var identity = shortVerifier.verify(TestTokens.token(secret, "u7", "Seven", 60_000));

        assertEquals("u7", identity.userId());
        assertEquals("Seven", identity.displayName());
        assertThrows(InvalidCredentialException.class, () -> shortVerifier.verify(TestTokens.token("u7")));
    }

    @Test
    void shouldRejectBlankSecret() {
        assertThrows(IllegalArgumentException.class, () -> new JwtCredentialVerifier(" "));
    }
}
