package com.workhub.server.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves SQS queue names to URLs lazily, caching hits and retrying misses no
 * more often than the configured interval.
 */
@Component
@ConditionalOnProperty(name = "hub.agent.enabled", havingValue = "true")
@Slf4j
public class SqsQueueResolver {

    private final SqsClient sqsClient;
    private final long retryIntervalMs;

    private final Map<String, String> queueUrlCache = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> queueUrlRetryTime = new ConcurrentHashMap<>();

    public SqsQueueResolver(SqsClient sqsClient,
                            @Value("${hub.agent.queue.retry.interval.ms:60000}") long retryIntervalMs) {
        this.sqsClient = sqsClient;
        this.retryIntervalMs = retryIntervalMs;
    }

    /**
     * @return the queue URL, or null if the queue is unknown and the retry
     *         interval has not elapsed
     */
    public String resolve(String queueName) {
        String cachedUrl = queueUrlCache.get(queueName);
        if (cachedUrl != null) {
            return cachedUrl;
        }

        AtomicLong lastRetry = queueUrlRetryTime.get(queueName);
        long currentTime = System.currentTimeMillis();

        if (lastRetry != null && (currentTime - lastRetry.get()) <= retryIntervalMs) {
            log.debug("Queue URL for {} not available. Next retry in {}ms",
                    queueName, retryIntervalMs - (currentTime - lastRetry.get()));
            return null;
        }

        try {
            log.info("Loading queue URL for {}", queueName);
            String queueUrl = sqsClient.getQueueUrl(GetQueueUrlRequest.builder()
                    .queueName(queueName)
                    .build()).queueUrl();
            queueUrlCache.put(queueName, queueUrl);
            queueUrlRetryTime.remove(queueName);
            log.info("Loaded queue URL for {}: {}", queueName, queueUrl);
            return queueUrl;
        } catch (QueueDoesNotExistException e) {
            log.warn("Queue {} does not exist. Will retry in {}ms", queueName, retryIntervalMs);
        } catch (Exception e) {
            log.warn("Failed to load queue URL for {}: {}. Will retry in {}ms",
                    queueName, e.getMessage(), retryIntervalMs);
        }

        queueUrlRetryTime.computeIfAbsent(queueName, k -> new AtomicLong()).set(currentTime);
        return null;
    }
}
