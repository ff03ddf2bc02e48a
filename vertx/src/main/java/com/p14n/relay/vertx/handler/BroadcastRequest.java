package com.p14n.relay.vertx.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.relay.data.EventType;

/**
 * A validated request to broadcast an event into a channel.
 *
 * @param type        the event type
 * @param channelName the target channel
 * @param message     the event data, forwarded as is
 */
public record BroadcastRequest(EventType type, String channelName, JsonNode message) {

    /**
     * Validates a request body of the form
     * {@code {"type": ..., "channelName": ..., "message": ...}}.
     *
     * <p>
     * The event type is checked first, so a body with an unknown type is
     * reported as such even if other fields are missing.
     * </p>
     *
     * @param body the parsed body, may be null
     * @return the request
     * @throws InvalidBroadcastRequestException if the body is not acceptable
     */
    public static BroadcastRequest parse(JsonNode body) {
        var type = EventType.fromWire(text(body, "type"))
                .orElseThrow(() -> new InvalidBroadcastRequestException(
                        "Invalid event type. Must be one of: " + EventType.wireNames()));

        var channelName = text(body, "channelName");
        var message = body.get("message");
        if (channelName == null || channelName.isEmpty() || message == null || message.isNull()
                || (message.isTextual() && message.asText().isEmpty())) {
            throw new InvalidBroadcastRequestException("Missing required fields: type, channelName, or message");
        }
        return new BroadcastRequest(type, channelName, message);
    }

    private static String text(JsonNode body, String field) {
        if (body == null) {
            return null;
        }
        var value = body.get(field);
        return value == null || !value.isTextual() ? null : value.asText();
    }
}
