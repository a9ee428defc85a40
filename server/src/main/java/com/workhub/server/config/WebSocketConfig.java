package com.workhub.server.config;

import com.workhub.server.handler.HubWebSocketHandler;
import com.workhub.server.handler.IdentityHandshakeInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final HubWebSocketHandler hubWebSocketHandler;
    private final IdentityHandshakeInterceptor identityHandshakeInterceptor;

    @Value("${hub.websocket.path:/ws}")
    private String path;

    @Value("${hub.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${hub.websocket.max-text-message-size:65536}")
    private int maxTextMessageSize;

    @Value("${hub.websocket.idle-timeout-ms:300000}")
    private long idleTimeoutMs;

    public WebSocketConfig(HubWebSocketHandler hubWebSocketHandler,
                           IdentityHandshakeInterceptor identityHandshakeInterceptor) {
        this.hubWebSocketHandler = hubWebSocketHandler;
        this.identityHandshakeInterceptor = identityHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Registering hub WebSocket endpoint at {}", path);
        registry.addHandler(hubWebSocketHandler, path)
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        container.setMaxSessionIdleTimeout(idleTimeoutMs);
        return container;
    }
}
