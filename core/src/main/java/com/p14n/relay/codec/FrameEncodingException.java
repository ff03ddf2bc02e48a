package com.p14n.relay.codec;

/**
 * Raised when a broadcast payload cannot be serialized.
 */
public class FrameEncodingException extends RuntimeException {

    public FrameEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
