package com.p14n.relay.connection;

/**
 * Liveness of a transport connection as seen by the relay.
 */
public enum ConnectionState {
    OPEN,
    CLOSING,
    CLOSED
}
