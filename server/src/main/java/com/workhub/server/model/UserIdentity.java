package com.workhub.server.model;

import lombok.Value;

/**
 * Authenticated principal behind a connection.
 */
@Value
public class UserIdentity {
    String userId;
    Role role;
    String teamId;
}
