package com.p14n.relay.data;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds that can be pushed to channel subscribers.
 *
 * <p>
 * The wire names are part of the client contract and are kept exactly as
 * clients expect them, including {@code MEMBER_STATUS_UPDATE} which does not
 * follow the kebab-case naming of its siblings.
 * </p>
 */
public enum EventType {

    SUBSCRIBE("subscribe"),
    NEW_MESSAGE("new-message"),
    MESSAGE_UPDATE("message-update"),
    MESSAGE_DELETE("message-delete"),
    MEMBER_TYPING("member-typing"),
    MEMBER_STOP_TYPING("member-stop-typing"),
    MEMBER_STATUS_UPDATE("MEMBER_STATUS_UPDATE");

    private final String wire;

    EventType(String wire) {
        this.wire = wire;
    }

    /**
     * Returns the name used for this event on the wire.
     *
     * @return the wire name
     */
    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Looks up an event type by its wire name.
     *
     * @param wire the wire name, may be null
     * @return the matching event type, or empty when the name is not recognised
     */
    public static Optional<EventType> fromWire(String wire) {
        if (wire == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wire.equals(wire))
                .findFirst();
    }

    /**
     * Comma separated list of every wire name, for client-facing error messages.
     *
     * @return the recognised wire names
     */
    public static String wireNames() {
        return Arrays.stream(values())
                .map(EventType::wire)
                .collect(Collectors.joining(", "));
    }
}
