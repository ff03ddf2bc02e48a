package com.p14n.relay.registry;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code MEMBER_STATUS_UPDATE} broadcast.
 *
 * @param channelName the channel whose presence changed, not sent on the wire
 * @param userId      the user whose status changed
 * @param isOnline    the new status
 * @param onlineUsers users online in the channel after the change
 */
public record PresenceUpdate(@JsonIgnore String channelName,
        @JsonProperty("userId") String userId,
        @JsonProperty("isOnline") boolean isOnline,
        @JsonProperty("onlineUsers") List<String> onlineUsers) {
}
