package com.workhub.server.handler;

import com.workhub.server.auth.AuthenticationException;
import com.workhub.server.auth.ConnectionAuthenticator;
import com.workhub.server.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Rejects upgrades without an identity and stores the identity in the session
 * attributes.
 */
@Component
@Slf4j
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "identity";

    private final ConnectionAuthenticator authenticator;

    public IdentityHandshakeInterceptor(ConnectionAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        try {
            UserIdentity identity = authenticator.authenticate(request);
            attributes.put(IDENTITY_ATTRIBUTE, identity);
            return true;
        } catch (AuthenticationException e) {
            log.warn("Rejected WebSocket handshake from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }
}
