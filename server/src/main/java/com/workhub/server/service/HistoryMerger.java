package com.workhub.server.service;

import com.workhub.server.model.DeliveredMessage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges fetched history with messages delivered live while the fetch was in
 * flight.
 */
final class HistoryMerger {

    private HistoryMerger() {
    }

    /**
     * History in store order, followed by the buffered messages the history did
     * not already contain, in arrival order. When a message is in both, the
     * history copy is kept.
     */
    static List<DeliveredMessage> merge(List<DeliveredMessage> history, List<DeliveredMessage> buffered) {
        List<DeliveredMessage> merged = new ArrayList<>(history.size() + buffered.size());
        Set<String> seen = new HashSet<>();

        for (DeliveredMessage message : history) {
            if (seen.add(message.identityKey())) {
                merged.add(message);
            }
            // rows without a message id can only be matched by content
            if (message.getMessageId() == null) {
                seen.add(message.tupleKey());
            }
        }

        for (DeliveredMessage message : buffered) {
            if (seen.contains(message.tupleKey()) && !seen.contains(message.identityKey())) {
                seen.add(message.identityKey());
                continue;
            }
            if (seen.add(message.identityKey())) {
                merged.add(message);
            }
        }
        return merged;
    }
}
