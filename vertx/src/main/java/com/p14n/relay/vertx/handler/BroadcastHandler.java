package com.p14n.relay.vertx.handler;

import java.util.LinkedHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.registry.Broadcaster;

import io.opentelemetry.api.trace.Tracer;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.relay.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Handles {@code POST /api/broadcast}: validates the body and fans the message
 * out to the named channel.
 */
public class BroadcastHandler implements Handler<RoutingContext> {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastHandler.class);

    private final Broadcaster broadcaster;
    private final ObjectMapper mapper;
    private final Tracer tracer;

    public BroadcastHandler(Broadcaster broadcaster, ObjectMapper mapper, Tracer tracer) {
        this.broadcaster = broadcaster;
        this.mapper = mapper;
        this.tracer = tracer;
    }

    @Override
    public void handle(RoutingContext ctx) {
        var response = ctx.response();
        JsonNode body;
        try {
            var text = ctx.body().asString();
            body = text == null || text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.atWarn()
                    .setCause(e)
                    .log("Broadcast request body is not valid JSON");
            JsonResponses.error(response, mapper, 400, "Request body must be valid JSON");
            return;
        }

        BroadcastRequest request;
        try {
            request = BroadcastRequest.parse(body);
        } catch (InvalidBroadcastRequestException e) {
            logger.atWarn()
                    .addArgument(e.getMessage())
                    .log("Rejected broadcast request: {}");
            JsonResponses.error(response, mapper, 400, e.getMessage());
            return;
        }

        long start = System.currentTimeMillis();
        try {
            logger.atInfo()
                    .addArgument(request.type().wire())
                    .addArgument(request.channelName())
                    .log("Broadcasting {} to {}");
            var result = processWithTelemetry(tracer, "broadcast", request.channelName(),
                    () -> broadcaster.broadcast(request.channelName(), request.type(), request.message()));

            var reply = new LinkedHashMap<String, Object>();
            reply.put("success", true);
            reply.put("delivered", result.delivered());
            JsonResponses.send(response, mapper, 200, reply);
            logger.atDebug()
                    .addArgument(System.currentTimeMillis() - start)
                    .log("Broadcast completed in {}ms");
        } catch (RuntimeException e) {
            logger.atError()
                    .addArgument(request.channelName())
                    .addArgument(System.currentTimeMillis() - start)
                    .setCause(e)
                    .log("Broadcast to {} failed after {}ms");
            JsonResponses.error(response, mapper, 500, "Failed to broadcast message");
        }
    }
}
