package com.p14n.relay.vertx.handler;

/**
 * Thrown when a broadcast request body is missing fields or names an unknown
 * event type. The message is returned to the caller.
 */
public class InvalidBroadcastRequestException extends RuntimeException {

    public InvalidBroadcastRequestException(String message) {
        super(message);
    }
}
