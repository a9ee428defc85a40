package com.workhub.server.agent;

import java.util.concurrent.CompletableFuture;

/**
 * Hand-off edge to the external AI agent service. Replies come back
 * asynchronously as agent_response messages.
 */
public interface AgentGateway {

    /**
     * Submit a user's message to the agent.
     *
     * @return completes when the request has been accepted by the agent
     *         transport, or exceptionally with {@link AgentUnavailableException}
     */
    CompletableFuture<Void> submit(AgentRequest request);

    boolean isAvailable();
}
