package com.p14n.relay.vertx.auth;

import com.p14n.relay.data.Identity;

/**
 * Turns the bearer token presented on a connection request into a verified
 * identity.
 */
public interface CredentialVerifier {

    /**
     * Verifies a token.
     *
     * @param token the token from the connection request
     * @return the identity the token was issued for
     * @throws InvalidCredentialException if the token cannot be trusted
     */
    Identity verify(String token);
}
