package com.workhub.server.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes agent requests to an SQS queue read by the agent service.
 */
@Component
@ConditionalOnProperty(name = "hub.agent.enabled", havingValue = "true")
@Slf4j
public class SqsAgentGateway implements AgentGateway {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final SqsQueueResolver queueResolver;
    private final Executor agentExecutor;
    private final String requestQueue;
    private final boolean fifoEnabled;

    private final AtomicLong requestsSent = new AtomicLong(0);
    private final AtomicLong requestsFailed = new AtomicLong(0);

    public SqsAgentGateway(SqsClient sqsClient,
                           ObjectMapper objectMapper,
                           SqsQueueResolver queueResolver,
                           @Qualifier("agentExecutor") Executor agentExecutor,
                           @Value("${hub.agent.request-queue:workhub-agent-requests}") String requestQueue,
                           @Value("${hub.agent.fifo.enabled:false}") boolean fifoEnabled) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueResolver = queueResolver;
        this.agentExecutor = agentExecutor;
        this.requestQueue = requestQueue;
        this.fifoEnabled = fifoEnabled;
    }

    @Override
    public CompletableFuture<Void> submit(AgentRequest request) {
        return CompletableFuture.runAsync(() -> send(request), agentExecutor);
    }

    @Override
    public boolean isAvailable() {
        return queueResolver.resolve(requestQueue) != null;
    }

    private void send(AgentRequest request) {
        String queueUrl = queueResolver.resolve(requestQueue);
        if (queueUrl == null) {
            requestsFailed.incrementAndGet();
            throw new AgentUnavailableException("Agent request queue " + requestQueue + " is not available");
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            requestsFailed.incrementAndGet();
            throw new CompletionException(e);
        }

        SendMessageRequest.Builder builder = SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(body);

        // FIFO queues keep one conversation in order
        if (fifoEnabled) {
            builder.messageGroupId(request.getSenderId())
                    .messageDeduplicationId(request.getMessageId());
        }

        try {
            SendMessageResponse response = sqsClient.sendMessage(builder.build());
            requestsSent.incrementAndGet();
            log.debug("Published agent request {} for user {}: sqsMessageId={}",
                    request.getMessageId(), request.getSenderId(), response.messageId());
        } catch (Exception e) {
            requestsFailed.incrementAndGet();
            log.error("Failed to publish agent request {} for user {}: {}",
                    request.getMessageId(), request.getSenderId(), e.getMessage());
            throw new AgentUnavailableException("Failed to reach the assistant", e);
        }
    }

    public long getRequestsSent() {
        return requestsSent.get();
    }

    public long getRequestsFailed() {
        return requestsFailed.get();
    }
}
