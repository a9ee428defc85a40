package com.workhub.server.service;

import lombok.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of routing one message. Live pushes are done by the time this is
 * returned; storage and agent hand-off complete later.
 */
@Value
public class RouteResult {
    String messageId;
    String clientMessageId;
    int livePushes;
    CompletableFuture<List<Long>> persisted;
    CompletableFuture<Void> agentForwarded;
}
