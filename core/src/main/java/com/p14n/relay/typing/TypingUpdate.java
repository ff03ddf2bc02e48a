package com.p14n.relay.typing;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code member-typing} broadcast: everyone typing in the channel.
 */
public record TypingUpdate(@JsonProperty("typingUsers") List<TypingEntry> typingUsers) {
}
