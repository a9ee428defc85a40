package com.workhub.server.persistence;

import com.workhub.server.model.PersistedRecord;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.model.UserIdentity;

import java.util.List;

/**
 * Durable message storage used by the hub. Calls may block on I/O; the hub
 * only invokes them from its own executors.
 */
public interface MessageStore {

    /**
     * Store one record of {@code message} addressed to {@code recipient}.
     *
     * @return the store-assigned record id
     * @throws PersistenceException if the record could not be stored
     */
    long persist(RoutedMessage message, RecipientSelector recipient);

    /**
     * Records visible to the user, oldest first: messages addressed to them,
     * messages they sent, and broadcasts to their role within their team.
     *
     * @param limit maximum number of most recent records to return
     * @throws PersistenceException if history could not be read
     */
    List<PersistedRecord> fetchHistory(UserIdentity user, int limit);
}
