package com.p14n.relay.vertx.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.data.EventType;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastRequestTest {

    private static final String MISSING = "Missing required fields: type, channelName, or message";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldParseValidRequest() throws Exception {
        var request = BroadcastRequest.parse(mapper.readTree(
                "{\"type\":\"message-update\",\"channelName\":\"general\",\"message\":{\"id\":3}}"));

        assertEquals(EventType.MESSAGE_UPDATE, request.type());
        assertEquals("general", request.channelName());
        assertEquals(3, request.message().get("id").asInt());
    }

    @Test
    void shouldRejectUnknownTypeBeforeMissingFields() throws Exception {
        var e = assertThrows(InvalidBroadcastRequestException.class,
                () -> BroadcastRequest.parse(mapper.readTree("{\"type\":\"shout\"}")));

        assertEquals("Invalid event type. Must be one of: subscribe, new-message, message-update, "
                + "message-delete, member-typing, member-stop-typing, MEMBER_STATUS_UPDATE", e.getMessage());
        assertThrows(InvalidBroadcastRequestException.class, () -> BroadcastRequest.parse(null));
    }

    @Test
    void shouldRejectMissingChannelOrMessage() throws Exception {
        var noChannel = mapper.readTree("{\"type\":\"new-message\",\"message\":{\"id\":1}}");
        var noMessage = mapper.readTree("{\"type\":\"new-message\",\"channelName\":\"general\"}");
        var nullMessage = mapper.readTree("{\"type\":\"new-message\",\"channelName\":\"general\",\"message\":null}");

        assertEquals(MISSING, assertThrows(InvalidBroadcastRequestException.class,
                () -> BroadcastRequest.parse(noChannel)).getMessage());
        assertEquals(MISSING, assertThrows(InvalidBroadcastRequestException.class,
                () -> BroadcastRequest.parse(noMessage)).getMessage());
        assertEquals(MISSING, assertThrows(InvalidBroadcastRequestException.class,
                () -> BroadcastRequest.parse(nullMessage)).getMessage());
    }
}
