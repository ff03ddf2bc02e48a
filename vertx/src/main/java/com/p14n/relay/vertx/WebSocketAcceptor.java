package com.p14n.relay.vertx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.data.Identity;
import com.p14n.relay.vertx.auth.CredentialVerifier;
import com.p14n.relay.vertx.auth.InvalidCredentialException;
import com.p14n.relay.vertx.handler.JsonResponses;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates WebSocket upgrade requests before accepting them.
 *
 * <p>
 * The token comes from the {@code token} query parameter. A request without
 * one, or with one that fails verification, is answered with 401 and never
 * upgraded, so the registry only sees authenticated connections.
 * </p>
 */
public class WebSocketAcceptor implements Handler<RoutingContext> {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketAcceptor.class);

    private final CredentialVerifier verifier;
    private final ConnectionHandler connectionHandler;
    private final ObjectMapper mapper;

    public WebSocketAcceptor(CredentialVerifier verifier, ConnectionHandler connectionHandler, ObjectMapper mapper) {
        this.verifier = verifier;
        this.connectionHandler = connectionHandler;
        this.mapper = mapper;
    }

    @Override
    public void handle(RoutingContext ctx) {
        var request = ctx.request();
        if (!"websocket".equalsIgnoreCase(request.getHeader("Upgrade"))) {
            ctx.next();
            return;
        }

        var token = request.getParam("token");
        if (token == null || token.isBlank()) {
            logger.atWarn()
                    .addArgument(request.remoteAddress())
                    .log("Rejected connection from {} without a token");
            JsonResponses.error(ctx.response(), mapper, 401, "Authentication required");
            return;
        }

        Identity identity;
        try {
            identity = verifier.verify(token);
        } catch (InvalidCredentialException e) {
            logger.atWarn()
                    .addArgument(request.remoteAddress())
                    .addArgument(e.getMessage())
                    .log("Rejected connection from {}: {}");
            JsonResponses.error(ctx.response(), mapper, 401, "Invalid authentication token");
            return;
        }

        request.toWebSocket()
                .onSuccess(socket -> connectionHandler.attach(socket, identity))
                .onFailure(e -> logger.atWarn()
                        .addArgument(identity.userId())
                        .setCause(e)
                        .log("WebSocket upgrade failed for {}"));
    }
}
