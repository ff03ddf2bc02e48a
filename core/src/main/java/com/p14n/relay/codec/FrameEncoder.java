package com.p14n.relay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.data.EventType;

/**
 * Encodes outbound frames as JSON text of the form
 * {@code {"event": <wire name>, "data": <payload>}}.
 *
 * <p>
 * A broadcast encodes its frame once and hands the same string to every
 * subscriber. Instances are thread-safe.
 * </p>
 */
public class FrameEncoder {

    private final ObjectMapper mapper;

    /**
     * Creates an encoder with a default {@link ObjectMapper}.
     */
    public FrameEncoder() {
        this(new ObjectMapper());
    }

    /**
     * Creates an encoder using the given mapper.
     *
     * @param mapper the configured mapper, shared with other components
     */
    public FrameEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Encodes an event and its payload.
     *
     * @param event   the event type
     * @param payload the event data; any value Jackson can serialize, or null
     * @return the JSON text of the frame
     * @throws FrameEncodingException if the payload cannot be serialized
     */
    public String encode(EventType event, Object payload) {
        try {
            return mapper.writeValueAsString(new Frame(event, payload));
        } catch (JsonProcessingException e) {
            throw new FrameEncodingException("Failed to encode " + event.wire() + " frame", e);
        }
    }

    private record Frame(EventType event, Object data) {
    }
}
