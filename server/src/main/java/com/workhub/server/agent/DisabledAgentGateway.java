package com.workhub.server.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Gateway used when no agent transport is configured. Messages to the agent are
 * still stored; the sender is told the assistant is unavailable.
 */
@Component
@ConditionalOnProperty(name = "hub.agent.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class DisabledAgentGateway implements AgentGateway {

    @Override
    public CompletableFuture<Void> submit(AgentRequest request) {
        log.debug("Agent disabled, not forwarding message {} from {}", request.getMessageId(), request.getSenderId());
        return CompletableFuture.failedFuture(new AgentUnavailableException("The assistant is not available"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
