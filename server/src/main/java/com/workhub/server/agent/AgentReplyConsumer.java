package com.workhub.server.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workhub.server.model.MessageKind;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.service.MessageRouter;
import com.workhub.server.service.RouteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Long-polls the agent response queue and routes each reply back to the user
 * who asked. A queue message is deleted only after the reply is stored, so a
 * storage failure leads to redelivery rather than loss.
 *
 * <p>A redelivered reply is routed again under the same message id. The user's
 * connection drops the repeated live push, but the store may hold the reply
 * twice, and a client that reconnects in between can see both copies in
 * history. Clients dedupe by {@code messageId}.
 */
@Service
@ConditionalOnProperty(name = "hub.agent.enabled", havingValue = "true")
@Slf4j
public class AgentReplyConsumer {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final SqsQueueResolver queueResolver;
    private final MessageRouter router;

    @Value("${hub.agent.response-queue:workhub-agent-responses}")
    private String responseQueue;

    @Value("${hub.agent.consumer.threads:2}")
    private int consumerThreads;

    @Value("${hub.agent.consumer.max.messages:10}")
    private int maxMessages;

    @Value("${hub.agent.consumer.wait.time:20}")
    private int waitTimeSeconds;

    @Value("${hub.agent.consumer.visibility.timeout:30}")
    private int visibilityTimeout;

    private ExecutorService consumerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong repliesRouted = new AtomicLong(0);
    private final AtomicLong repliesFailed = new AtomicLong(0);

    public AgentReplyConsumer(SqsClient sqsClient,
                              ObjectMapper objectMapper,
                              SqsQueueResolver queueResolver,
                              MessageRouter router) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueResolver = queueResolver;
        this.router = router;
    }

    @PostConstruct
    public void init() {
        log.info("Starting agent reply consumer on queue {} with {} threads", responseQueue, consumerThreads);
        running.set(true);

        AtomicLong threadCounter = new AtomicLong(0);
        consumerExecutor = Executors.newFixedThreadPool(consumerThreads, r -> {
            Thread thread = new Thread(r, "agent-reply-consumer-" + threadCounter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        });

        for (int i = 1; i <= consumerThreads; i++) {
            final int threadNum = i;
            consumerExecutor.submit(() -> {
                try {
                    consumeLoop(threadNum);
                } catch (Exception e) {
                    log.error("Agent reply consumer thread {} crashed: {}", threadNum, e.getMessage(), e);
                } finally {
                    log.info("Agent reply consumer thread {} stopped", threadNum);
                }
            });
        }
    }

    private void consumeLoop(int threadNum) {
        int loopIterations = 0;

        while (running.get()) {
            loopIterations++;
            try {
                String queueUrl = queueResolver.resolve(responseQueue);
                if (queueUrl == null) {
                    if (loopIterations % 100 == 1) {
                        log.warn("Thread {}: response queue {} not found (will retry)", threadNum, responseQueue);
                    }
                    Thread.sleep(1000);
                    continue;
                }

                List<Message> messages = sqsClient.receiveMessage(ReceiveMessageRequest.builder()
                        .queueUrl(queueUrl)
                        .maxNumberOfMessages(maxMessages)
                        .waitTimeSeconds(waitTimeSeconds)
                        .visibilityTimeout(visibilityTimeout)
                        .build()).messages();

                for (Message message : messages) {
                    if (!running.get()) {
                        break;
                    }
                    handle(message, queueUrl);
                }
            } catch (InterruptedException e) {
                log.info("Thread {} interrupted, stopping", threadNum);
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Thread {}: error polling agent replies: {}", threadNum, e.getMessage(), e);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Route one queue message. Malformed bodies are deleted so they do not
     * redeliver forever.
     */
    void handle(Message message, String queueUrl) {
        AgentReply reply;
        try {
            reply = objectMapper.readValue(message.body(), AgentReply.class);
        } catch (Exception e) {
            log.error("Discarding malformed agent reply {}: {}", message.messageId(), e.getMessage());
            repliesFailed.incrementAndGet();
            deleteMessage(queueUrl, message.receiptHandle());
            return;
        }

        if (reply.getSenderId() == null || reply.getTeamId() == null || reply.getContent() == null) {
            log.error("Discarding agent reply {} without recipient, team or content", message.messageId());
            repliesFailed.incrementAndGet();
            deleteMessage(queueUrl, message.receiptHandle());
            return;
        }

        RoutedMessage routed = RoutedMessage.builder()
                // Same id on redelivery, so history reconciliation drops the repeat.
                .messageId(replyMessageId(message))
                .senderId(RecipientSelector.AGENT_ID)
                .teamId(reply.getTeamId())
                .kind(MessageKind.AGENT_RESPONSE)
                .content(reply.getContent())
                .recipient(RecipientSelector.user(reply.getSenderId()))
                .build();

        RouteResult result;
        try {
            result = router.route(routed);
        } catch (Exception e) {
            log.error("Failed to route agent reply {} to {}: {}", message.messageId(), reply.getSenderId(), e.getMessage());
            repliesFailed.incrementAndGet();
            deleteMessage(queueUrl, message.receiptHandle());
            return;
        }

        result.getPersisted().whenComplete((ids, error) -> {
            if (error != null) {
                repliesFailed.incrementAndGet();
                log.warn("Agent reply {} not stored, leaving it for redelivery: {}", message.messageId(), error.getMessage());
                return;
            }
            repliesRouted.incrementAndGet();
            deleteMessage(queueUrl, message.receiptHandle());
        });
    }

    private static String replyMessageId(Message message) {
        return UUID.nameUUIDFromBytes(("agent-reply:" + message.messageId()).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private void deleteMessage(String queueUrl, String receiptHandle) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .build());
        } catch (Exception e) {
            log.error("Failed to delete message from agent response queue: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down agent reply consumer...");
        running.set(false);

        if (consumerExecutor != null) {
            consumerExecutor.shutdown();
            try {
                if (!consumerExecutor.awaitTermination(waitTimeSeconds + 10L, TimeUnit.SECONDS)) {
                    log.warn("Agent reply consumer threads did not terminate in time, forcing shutdown");
                    consumerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                consumerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Agent reply consumer stopped. Replies routed: {}, failed: {}", repliesRouted.get(), repliesFailed.get());
    }

    public long getRepliesRouted() {
        return repliesRouted.get();
    }

    public long getRepliesFailed() {
        return repliesFailed.get();
    }

    public boolean isRunning() {
        return running.get();
    }
}
