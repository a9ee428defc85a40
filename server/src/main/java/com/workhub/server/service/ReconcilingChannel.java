package com.workhub.server.service;

import com.workhub.server.model.DeliveredMessage;
import com.workhub.server.model.OutboundFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Channel decorator that holds back live messages until the initial history
 * has been sent, then passes everything straight through.
 *
 * <p>A message frame whose message id this channel has already delivered,
 * live or in history, is dropped. The same message can reach a connection
 * twice when it is pushed again after storage completes, or when an agent
 * reply is redelivered by the queue.
 */
@Slf4j
public class ReconcilingChannel implements HubChannel {

    private final HubChannel delegate;
    private final int bufferLimit;
    private final Object lock = new Object();

    private final List<DeliveredMessage> buffered = new ArrayList<>();
    private final Set<String> delivered;
    private boolean live = false;
    private int overflowed = 0;
    private int suppressed = 0;

    public ReconcilingChannel(HubChannel delegate, int bufferLimit) {
        this(delegate, bufferLimit, bufferLimit);
    }

    /**
     * @param recentLimit how many delivered message ids are remembered for
     *                    duplicate suppression
     */
    public ReconcilingChannel(HubChannel delegate, int bufferLimit, int recentLimit) {
        this.delegate = delegate;
        this.bufferLimit = bufferLimit;
        this.delivered = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > recentLimit;
            }
        });
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public boolean send(OutboundFrame frame) {
        synchronized (lock) {
            if (frame.getType() != OutboundFrame.Type.MESSAGE) {
                return delegate.send(frame);
            }
            String key = frame.getMessage().identityKey();
            if (delivered.contains(key) || (!live && isBuffered(key))) {
                suppressed++;
                log.debug("Dropping repeat of message {} on channel {}", frame.getMessage().getMessageId(), getId());
                return true;
            }
            if (!live) {
                if (buffered.size() >= bufferLimit) {
                    // stored anyway; the client sees it on its next history load
                    overflowed++;
                    log.warn("History buffer full for channel {}, message {} will only appear after reconnect",
                            getId(), frame.getMessage().getMessageId());
                    return false;
                }
                buffered.add(frame.getMessage());
                return true;
            }
            boolean accepted = delegate.send(frame);
            if (accepted) {
                delivered.add(key);
            }
            return accepted;
        }
    }

    private boolean isBuffered(String key) {
        for (DeliveredMessage message : buffered) {
            if (message.identityKey().equals(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        delegate.close();
    }

    /**
     * Send the merged initial state and switch to live delivery. Only the first
     * call has any effect.
     *
     * @param history            fetched history, oldest first; empty if unavailable
     * @param historyAvailable   false when the fetch failed
     * @return the merged list that was sent, or null if already live
     */
    List<DeliveredMessage> completeHistory(List<DeliveredMessage> history, boolean historyAvailable) {
        synchronized (lock) {
            if (live) {
                return null;
            }
            List<DeliveredMessage> merged = HistoryMerger.merge(history, buffered);
            delegate.send(OutboundFrame.history(merged, historyAvailable));
            for (DeliveredMessage message : merged) {
                delivered.add(message.identityKey());
            }
            buffered.clear();
            live = true;
            return merged;
        }
    }

    boolean isLive() {
        synchronized (lock) {
            return live;
        }
    }

    int bufferedCount() {
        synchronized (lock) {
            return buffered.size();
        }
    }

    int overflowedCount() {
        synchronized (lock) {
            return overflowed;
        }
    }

    int suppressedCount() {
        synchronized (lock) {
            return suppressed;
        }
    }
}
