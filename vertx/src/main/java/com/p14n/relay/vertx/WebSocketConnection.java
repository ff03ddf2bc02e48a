package com.p14n.relay.vertx;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.relay.connection.ConnectionState;
import com.p14n.relay.connection.RelayConnection;
import com.p14n.relay.data.Identity;

import io.vertx.core.http.ServerWebSocket;

/**
 * {@link RelayConnection} over a Vert.x server WebSocket.
 *
 * <p>
 * Frames go onto the socket's write queue. When the queue is over its high
 * water mark the frame is refused rather than buffered further.
 * </p>
 */
public class WebSocketConnection implements RelayConnection {

    private final String id = UUID.randomUUID().toString();
    private final ServerWebSocket socket;
    private final Identity identity;
    private final AtomicBoolean closing = new AtomicBoolean(false);

    public WebSocketConnection(ServerWebSocket socket, Identity identity) {
        this.socket = socket;
        this.identity = identity;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Optional<Identity> identity() {
        return Optional.ofNullable(identity);
    }

    @Override
    public ConnectionState state() {
        if (socket.isClosed()) {
            return ConnectionState.CLOSED;
        }
        return closing.get() ? ConnectionState.CLOSING : ConnectionState.OPEN;
    }

    @Override
    public boolean send(String frame) {
        if (state() != ConnectionState.OPEN || socket.writeQueueFull()) {
            return false;
        }
        socket.writeTextMessage(frame);
        return true;
    }

    /**
     * Marks the connection as closing.
     *
     * @return true on the first call only
     */
    boolean markClosing() {
        return closing.compareAndSet(false, true);
    }

    String remoteAddress() {
        var address = socket.remoteAddress();
        return address == null ? "unknown" : address.toString();
    }
}
