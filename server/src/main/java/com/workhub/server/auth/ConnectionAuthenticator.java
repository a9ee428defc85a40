package com.workhub.server.auth;

import com.workhub.server.model.UserIdentity;
import org.springframework.http.server.ServerHttpRequest;

/**
 * Resolves the identity behind a WebSocket upgrade request.
 */
public interface ConnectionAuthenticator {

    /**
     * @throws AuthenticationException if the request carries no valid identity
     */
    UserIdentity authenticate(ServerHttpRequest request);
}
