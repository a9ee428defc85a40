package com.workhub.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serializes writes to each WebSocket session on a shared writer pool.
 * Frames for one session are written in the order they were queued, and a slow
 * session only holds up its own queue.
 */
@Service
@Slf4j
public class WebSocketWriteManager {

    // Write state per session id
    private final ConcurrentHashMap<String, SessionWriter> writers = new ConcurrentHashMap<>();

    // Shared thread pool for all writes
    private ExecutorService writerExecutor;

    @Value("${websocket.writer.threads:16}")
    private int writerThreads;

    @Value("${websocket.writer.queue.capacity:1000}")
    private int queueCapacity;

    // Metrics
    private final AtomicLong totalMessagesSent = new AtomicLong(0);
    private final AtomicLong totalMessagesQueued = new AtomicLong(0);
    private final AtomicLong totalMessagesDropped = new AtomicLong(0);
    private final AtomicLong totalWriteErrors = new AtomicLong(0);

    public WebSocketWriteManager() {
    }

    WebSocketWriteManager(int writerThreads, int queueCapacity) {
        this.writerThreads = writerThreads;
        this.queueCapacity = queueCapacity;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing WebSocketWriteManager with {} writer threads", writerThreads);
        AtomicLong threadCounter = new AtomicLong(0);
        writerExecutor = Executors.newFixedThreadPool(writerThreads, r -> {
            Thread t = new Thread(r, "ws-writer-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a session for managed writes.
     *
     * @param onWriteFailure run once if a write to the session fails, so the
     *                       owner can treat it as a disconnect
     */
    public void registerSession(WebSocketSession session, Runnable onWriteFailure) {
        SessionWriter writer = new SessionWriter(session, onWriteFailure, queueCapacity);
        if (writers.putIfAbsent(session.getId(), writer) != null) {
            log.warn("Session {} already registered, skipping", session.getId());
            return;
        }
        log.debug("Registered session {}", session.getId());
    }

    public void unregisterSession(String sessionId) {
        SessionWriter writer = writers.remove(sessionId);
        if (writer == null) {
            return;
        }
        writer.active = false;

        int pending = writer.queue.size();
        if (pending > 0) {
            log.warn("Session {} unregistered with {} messages still queued", sessionId, pending);
            totalMessagesDropped.addAndGet(pending);
        }
        log.debug("Unregistered session {}", sessionId);
    }

    /**
     * Queue a message for the session.
     *
     * @return true if queued, false if the queue is full or the session is not
     *         registered
     */
    public boolean sendMessage(WebSocketSession session, String payload) {
        SessionWriter writer = writers.get(session.getId());

        if (writer == null || !writer.active || writer.closeStatus.get() != null) {
            log.debug("Session {} is not writable, dropping message", session.getId());
            totalMessagesDropped.incrementAndGet();
            return false;
        }

        if (!writer.queue.offer(new TextMessage(payload))) {
            log.warn("Write queue full for session {}, dropping message", session.getId());
            totalMessagesDropped.incrementAndGet();
            return false;
        }

        totalMessagesQueued.incrementAndGet();
        scheduleWrite(writer);
        return true;
    }

    /**
     * Close the session once everything queued before this call has been written.
     */
    public void closeAfterDrain(WebSocketSession session, CloseStatus status) {
        SessionWriter writer = writers.get(session.getId());
        if (writer == null) {
            closeSession(session, status);
            return;
        }
        if (writer.closeStatus.compareAndSet(null, status)) {
            scheduleWrite(writer);
        }
    }

    /**
     * Schedule a drain task for the session if one is not already running.
     * Uses the work-in-progress counter so only one thread writes to a session.
     */
    private void scheduleWrite(SessionWriter writer) {
        if (writer.wip.getAndIncrement() == 0) {
            try {
                writerExecutor.execute(() -> drain(writer));
            } catch (RejectedExecutionException e) {
                log.error("Failed to submit write task for session {}: {}", writer.session.getId(), e.getMessage());
                writer.wip.decrementAndGet();
            }
        }
    }

    private void drain(SessionWriter writer) {
        WebSocketSession session = writer.session;
        int missed = 1;

        do {
            TextMessage message;
            while ((message = writer.queue.poll()) != null) {
                if (!session.isOpen()) {
                    log.warn("Session {} closed during write processing", session.getId());
                    fail(writer);
                    return;
                }

                try {
                    session.sendMessage(message);
                    totalMessagesSent.incrementAndGet();
                } catch (IOException | IllegalStateException e) {
                    log.error("Failed to send message to session {}: {}", session.getId(), e.getMessage());
                    totalWriteErrors.incrementAndGet();
                    fail(writer);
                    return;
                }
            }

            CloseStatus status = writer.closeStatus.get();
            if (status != null) {
                unregisterSession(session.getId());
                closeSession(session, status);
                return;
            }

            missed = writer.wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void fail(SessionWriter writer) {
        unregisterSession(writer.session.getId());
        try {
            writer.onWriteFailure.run();
        } catch (Exception e) {
            log.error("Write failure callback for session {} threw: {}", writer.session.getId(), e.getMessage(), e);
        }
    }

    private void closeSession(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.warn("Failed to close session {}: {}", session.getId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down WebSocketWriteManager...");

        if (writerExecutor != null) {
            writerExecutor.shutdown();
            try {
                if (!writerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    writerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                writerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        writers.clear();
        log.info("WebSocketWriteManager shutdown complete");
    }

    public long getTotalMessagesSent() {
        return totalMessagesSent.get();
    }

    public long getTotalMessagesQueued() {
        return totalMessagesQueued.get();
    }

    public long getTotalMessagesDropped() {
        return totalMessagesDropped.get();
    }

    public long getTotalWriteErrors() {
        return totalWriteErrors.get();
    }

    public int getActiveSessionCount() {
        return writers.size();
    }

    public int getActiveWriterThreadCount() {
        if (writerExecutor instanceof ThreadPoolExecutor) {
            return ((ThreadPoolExecutor) writerExecutor).getActiveCount();
        }
        return 0;
    }

    private static final class SessionWriter {
        final WebSocketSession session;
        final Runnable onWriteFailure;
        final BlockingQueue<TextMessage> queue;
        final AtomicInteger wip = new AtomicInteger(0);
        final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
        volatile boolean active = true;

        SessionWriter(WebSocketSession session, Runnable onWriteFailure, int capacity) {
            this.session = session;
            this.onWriteFailure = onWriteFailure;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }
    }
}
