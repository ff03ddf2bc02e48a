package com.p14n.relay.vertx.auth;

/**
 * Thrown when a connection token is missing, malformed, expired or signed with
 * the wrong key.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
