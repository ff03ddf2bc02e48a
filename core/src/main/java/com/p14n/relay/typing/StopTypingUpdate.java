package com.p14n.relay.typing;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code member-stop-typing} broadcast.
 */
public record StopTypingUpdate(@JsonProperty("userId") String userId,
        @JsonProperty("username") String displayName,
        @JsonProperty("remainingTypingUsers") List<TypingEntry> remainingTypingUsers) {
}
