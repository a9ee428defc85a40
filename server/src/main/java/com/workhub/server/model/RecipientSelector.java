package com.workhub.server.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Who a message is addressed to: explicit users, every user of a role within a
 * team, or the external agent.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecipientSelector {

    public enum Type {
        USERS, ROLE_IN_TEAM, AGENT
    }

    public static final String AGENT_ID = "agent";

    Type type;
    List<String> userIds;
    Role role;
    String teamId;

    public static RecipientSelector user(String userId) {
        return users(List.of(Objects.requireNonNull(userId, "userId")));
    }

    public static RecipientSelector users(List<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient is required");
        }
        return new RecipientSelector(Type.USERS, List.copyOf(userIds), null, null);
    }

    public static RecipientSelector roleInTeam(Role role, String teamId) {
        return new RecipientSelector(Type.ROLE_IN_TEAM, List.of(),
                Objects.requireNonNull(role, "role"), Objects.requireNonNull(teamId, "teamId"));
    }

    public static RecipientSelector agent() {
        return new RecipientSelector(Type.AGENT, List.of(), null, null);
    }

    /**
     * The single addressed user. Only valid for a one-user selector.
     */
    public String singleUser() {
        if (type != Type.USERS || userIds.size() != 1) {
            throw new IllegalStateException("Selector does not address exactly one user: " + this);
        }
        return userIds.get(0);
    }
}
