package com.workhub.server.auth;

import com.workhub.server.model.Role;
import com.workhub.server.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the identity that the API gateway puts on the upgrade request after
 * validating the user's token. The hub must only be reachable through that
 * gateway.
 */
@Component
@Slf4j
public class TrustedGatewayAuthenticator implements ConnectionAuthenticator {

    private final String userIdHeader;
    private final String roleHeader;
    private final String teamIdHeader;

    public TrustedGatewayAuthenticator(@Value("${hub.auth.header.user-id:X-User-Id}") String userIdHeader,
                                       @Value("${hub.auth.header.role:X-User-Role}") String roleHeader,
                                       @Value("${hub.auth.header.team-id:X-Team-Id}") String teamIdHeader) {
        this.userIdHeader = userIdHeader;
        this.roleHeader = roleHeader;
        this.teamIdHeader = teamIdHeader;
    }

    @Override
    public UserIdentity authenticate(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String userId = required(headers, userIdHeader);
        String roleValue = required(headers, roleHeader);
        String teamId = required(headers, teamIdHeader);

        Role role;
        try {
            role = Role.fromString(roleValue);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Unknown role: " + roleValue);
        }

        return new UserIdentity(userId, role, teamId);
    }

    private static String required(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        if (value == null || value.trim().isEmpty()) {
            throw new AuthenticationException("Missing " + name + " header");
        }
        return value.trim();
    }
}
