package com.workhub.server.model;

import com.workhub.server.service.HubChannel;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * One live connection held by the registry.
 */
@Value
public class ConnectionEntry {
    String userId;
    Role role;
    String teamId;
    HubChannel channel;
    Instant connectedAt;

    public ConnectionEntry(String userId, Role role, String teamId, HubChannel channel) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.role = Objects.requireNonNull(role, "role");
        this.teamId = Objects.requireNonNull(teamId, "teamId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectedAt = Instant.now();
    }

    public static ConnectionEntry of(UserIdentity identity, HubChannel channel) {
        return new ConnectionEntry(identity.getUserId(), identity.getRole(), identity.getTeamId(), channel);
    }
}
