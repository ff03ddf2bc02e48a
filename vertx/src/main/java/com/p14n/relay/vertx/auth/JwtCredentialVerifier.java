package com.p14n.relay.vertx.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.p14n.relay.data.Identity;

/**
 * Verifies HMAC-SHA256 signed JWTs issued with a shared secret.
 *
 * <p>
 * The secret may be of any length, so tokens from producers using short
 * secrets are accepted. The token must carry a {@code userId} claim.
 * {@code name} and {@code image} are optional and become the display name and
 * avatar of the identity. Expired tokens are rejected.
 * </p>
 */
public class JwtCredentialVerifier implements CredentialVerifier {

    private final JWTVerifier verifier;

    /**
     * Creates a verifier for the given secret.
     *
     * @param secret the shared secret
     * @throws IllegalArgumentException if the secret is null or blank
     */
    public JwtCredentialVerifier(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("JWT secret cannot be null or empty");
        }
        this.verifier = JWT.require(Algorithm.HMAC256(secret)).build();
    }

    @Override
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialException("Authentication required");
        }
        DecodedJWT jwt;
        try {
            jwt = verifier.verify(token);
        } catch (JWTVerificationException e) {
            throw new InvalidCredentialException("Invalid authentication token", e);
        }

        var userId = jwt.getClaim("userId").asString();
        if (userId == null || userId.isBlank()) {
            throw new InvalidCredentialException("Token has no userId claim");
        }
        var name = jwt.getClaim("name").asString();
        return new Identity(userId, name == null ? userId : name, jwt.getClaim("image").asString());
    }
}
