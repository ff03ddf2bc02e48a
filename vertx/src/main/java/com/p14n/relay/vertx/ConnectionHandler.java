package com.p14n.relay.vertx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.connection.RelayConnection;
import com.p14n.relay.data.Identity;
import com.p14n.relay.registry.ChannelRegistry;

import io.vertx.core.http.ServerWebSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires an accepted WebSocket to the registry.
 *
 * <p>
 * Inbound text frames are JSON objects with a {@code type} field:
 * </p>
 * <ul>
 * <li>{@code subscribe}: {@code channelName}, {@code userId} and optional
 * {@code userInfo}</li>
 * <li>{@code unsubscribe}: {@code channelName}</li>
 * <li>{@code typing}: {@code channelName} and {@code isTyping}, only accepted
 * for a channel the connection is subscribed to</li>
 * </ul>
 * <p>
 * Anything else is logged and dropped. When the socket closes, the connection
 * is torn down in the registry exactly once.
 * </p>
 */
public class ConnectionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final ChannelRegistry registry;
    private final ObjectMapper mapper;
    private final ConnectionStats stats;

    public ConnectionHandler(ChannelRegistry registry, ObjectMapper mapper, ConnectionStats stats) {
        this.registry = registry;
        this.mapper = mapper;
        this.stats = stats;
    }

    /**
     * Starts handling an accepted socket.
     *
     * @param socket   the upgraded socket
     * @param identity the identity verified from the connection token
     * @return the connection registered for the socket
     */
    public WebSocketConnection attach(ServerWebSocket socket, Identity identity) {
        var connection = new WebSocketConnection(socket, identity);
        stats.opened();
        logger.atInfo()
                .addArgument(connection.id())
                .addArgument(identity.userId())
                .addArgument(connection.remoteAddress())
                .addArgument(stats.activeConnections())
                .log("Accepted connection {} for {} from {}, {} active");

        socket.textMessageHandler(text -> onFrame(connection, text));
        socket.exceptionHandler(e -> logger.atWarn()
                .addArgument(connection.id())
                .setCause(e)
                .log("Transport error on connection {}"));
        socket.closeHandler(v -> onClose(connection));
        return connection;
    }

    void onFrame(RelayConnection connection, String text) {
        JsonNode frame;
        try {
            frame = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.atError()
                    .addArgument(connection.id())
                    .setCause(e)
                    .log("Unparseable frame from connection {}");
            return;
        }
        if (frame == null || !frame.isObject()) {
            logger.atError()
                    .addArgument(connection.id())
                    .log("Frame from connection {} is not a JSON object");
            return;
        }

        var type = frame.path("type").asText("");
        var channelName = frame.path("channelName").asText("");
        switch (type) {
            case "subscribe" -> subscribe(connection, channelName, frame);
            case "unsubscribe" -> unsubscribeFrom(connection, channelName);
            case "typing" -> typing(connection, channelName, frame.path("isTyping").asBoolean(true));
            default -> logger.atDebug()
                    .addArgument(type)
                    .addArgument(connection.id())
                    .log("Ignoring frame of type '{}' from connection {}");
        }
    }

    private void subscribe(RelayConnection connection, String channelName, JsonNode frame) {
        var userId = frame.path("userId").asText(null);
        if (userId == null) {
            userId = connection.identity().map(Identity::userId).orElse(null);
        }
        if (channelName.isBlank() || userId == null) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .log("Subscribe frame from connection {} is missing channelName or userId");
            return;
        }
        var userInfo = frame.get("userInfo");
        registry.subscribe(channelName, connection, userId, userInfo == null || userInfo.isNull() ? null : userInfo);
    }

    private void unsubscribeFrom(RelayConnection connection, String channelName) {
        if (channelName.isBlank()) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .log("Unsubscribe frame from connection {} is missing channelName");
            return;
        }
        registry.unsubscribe(channelName, connection);
    }

    private void typing(RelayConnection connection, String channelName, boolean isTyping) {
        var identity = connection.identity();
        if (identity.isEmpty() || !registry.isSubscribed(channelName, connection)) {
            logger.atDebug()
                    .addArgument(connection.id())
                    .addArgument(channelName)
                    .log("Ignoring typing from connection {} not subscribed to {}");
            return;
        }
        var user = identity.get();
        var displayName = user.displayName() == null ? user.userId() : user.displayName();
        registry.typingTracker().setTyping(channelName, user.userId(), displayName, isTyping);
    }

    void onClose(WebSocketConnection connection) {
        if (!connection.markClosing()) {
            return;
        }
        stats.closed();
        var channels = registry.teardown(connection);
        logger.atInfo()
                .addArgument(connection.id())
                .addArgument(channels)
                .addArgument(stats.activeConnections())
                .addArgument(stats.totalConnections())
                .log("Connection {} closed, left {} channels, {} active of {} total");
    }
}
