package com.p14n.relay.connection;

import java.util.Optional;

import com.p14n.relay.data.Identity;

/**
 * Handle to a duplex client connection owned by the transport layer.
 *
 * <p>
 * The registry only keeps references to connections and keys its indexes by
 * object identity, so implementations must not override {@code equals} or
 * {@code hashCode}.
 * </p>
 *
 * <p>
 * {@link #send(String)} is called while fanning out a broadcast and must never
 * block: implementations enqueue onto their own outbound buffer and return
 * {@code false} when that buffer cannot take the frame.
 * </p>
 */
public interface RelayConnection {

    /**
     * Returns an identifier for logging.
     *
     * @return the connection id
     */
    String id();

    /**
     * Returns the identity verified when the connection was accepted.
     *
     * @return the identity, or empty for unauthenticated transports
     */
    Optional<Identity> identity();

    /**
     * Returns the current liveness of the connection.
     *
     * @return the connection state
     */
    ConnectionState state();

    /**
     * Queues a text frame for delivery without blocking.
     *
     * @param frame the encoded frame
     * @return true if the frame was accepted for delivery
     */
    boolean send(String frame);
}
