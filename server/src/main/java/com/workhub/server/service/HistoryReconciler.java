package com.workhub.server.service;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.DeliveredMessage;
import com.workhub.server.model.PersistedRecord;
import com.workhub.server.model.RegistrationResult;
import com.workhub.server.model.UserIdentity;
import com.workhub.server.persistence.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connects a user so that they receive one ordered, duplicate-free initial
 * view: stored history plus whatever was routed to them while it loaded.
 */
@Service
@Slf4j
public class HistoryReconciler {

    private final ConnectionRegistry registry;
    private final MessageStore messageStore;
    private final Executor historyExecutor;
    private final int historyLimit;
    private final int bufferLimit;

    private final AtomicLong historiesDelivered = new AtomicLong(0);
    private final AtomicLong historyFailures = new AtomicLong(0);
    private final AtomicLong historiesAbandoned = new AtomicLong(0);
    private final AtomicLong duplicatesDropped = new AtomicLong(0);

    public HistoryReconciler(ConnectionRegistry registry,
                             MessageStore messageStore,
                             @Qualifier("historyExecutor") Executor historyExecutor,
                             @Value("${hub.history.limit:200}") int historyLimit,
                             @Value("${hub.history.buffer.limit:500}") int bufferLimit) {
        this.registry = registry;
        this.messageStore = messageStore;
        this.historyExecutor = historyExecutor;
        this.historyLimit = historyLimit;
        this.bufferLimit = bufferLimit;
    }

    /**
     * Register the user on a buffering wrapper of {@code channel} and start the
     * history fetch. Returns as soon as the registration is in place.
     */
    public Connection connect(UserIdentity identity, HubChannel channel) {
        ReconcilingChannel reconciling = new ReconcilingChannel(channel, bufferLimit, historyLimit + bufferLimit);
        RegistrationResult registration = registry.register(ConnectionEntry.of(identity, reconciling));
        CompletableFuture<List<DeliveredMessage>> initialState = loadAndMerge(identity, reconciling);
        return new Connection(registration, reconciling, initialState);
    }

    private CompletableFuture<List<DeliveredMessage>> loadAndMerge(UserIdentity identity, ReconcilingChannel channel) {
        CompletableFuture<List<PersistedRecord>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(
                    () -> messageStore.fetchHistory(identity, historyLimit), historyExecutor);
        } catch (RejectedExecutionException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch.handle((records, error) -> {
            if (!isStillConnected(identity.getUserId(), channel)) {
                historiesAbandoned.incrementAndGet();
                log.debug("Discarding history for user {}: channel {} is gone", identity.getUserId(), channel.getId());
                return null;
            }

            if (error != null) {
                historyFailures.incrementAndGet();
                log.warn("History unavailable for user {}, sending live messages only: {}",
                        identity.getUserId(), error.getMessage());
                return channel.completeHistory(List.of(), false);
            }

            List<DeliveredMessage> history = new ArrayList<>(records.size());
            for (PersistedRecord record : records) {
                history.add(DeliveredMessage.fromHistory(record));
            }

            int buffered = channel.bufferedCount();
            List<DeliveredMessage> merged = channel.completeHistory(history, true);
            if (merged != null) {
                historiesDelivered.incrementAndGet();
                int dropped = history.size() + buffered - merged.size();
                duplicatesDropped.addAndGet(Math.max(dropped, 0));
                log.debug("Delivered initial state to user {}: {} history, {} buffered, {} merged",
                        identity.getUserId(), history.size(), buffered, merged.size());
            }
            return merged;
        }).exceptionally(e -> {
            log.error("Failed to deliver initial state to user {}: {}", identity.getUserId(), e.getMessage(), e);
            return null;
        });
    }

    private boolean isStillConnected(String userId, ReconcilingChannel channel) {
        return channel.isOpen() && registry.lookup(userId).map(live -> live == channel).orElse(false);
    }

    public long getHistoriesDelivered() {
        return historiesDelivered.get();
    }

    public long getHistoryFailures() {
        return historyFailures.get();
    }

    public long getHistoriesAbandoned() {
        return historiesAbandoned.get();
    }

    public long getDuplicatesDropped() {
        return duplicatesDropped.get();
    }

    /**
     * A connection made through {@link #connect}. {@code channel} is the
     * instance held by the registry and must be passed to
     * {@link ConnectionRegistry#unregister} on close.
     */
    public static final class Connection {
        private final RegistrationResult registration;
        private final ReconcilingChannel channel;
        private final CompletableFuture<List<DeliveredMessage>> initialState;

        Connection(RegistrationResult registration, ReconcilingChannel channel,
                   CompletableFuture<List<DeliveredMessage>> initialState) {
            this.registration = registration;
            this.channel = channel;
            this.initialState = initialState;
        }

        public RegistrationResult getRegistration() {
            return registration;
        }

        public HubChannel getChannel() {
            return channel;
        }

        /**
         * Completes with the merged list sent to the client, or null if the
         * connection was gone before history arrived. Never completes
         * exceptionally.
         */
        public CompletableFuture<List<DeliveredMessage>> getInitialState() {
            return initialState;
        }
    }
}
