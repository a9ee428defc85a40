package com.workhub.server.service;

import com.workhub.server.model.ConnectionEntry;

/**
 * Observer of registry mutations. Invoked synchronously while the registry
 * holds the lock for the affected user, so implementations must not block.
 */
public interface RegistryListener {

    /**
     * @param entry      the entry now installed
     * @param superseded whether an earlier connection of the same user was replaced
     */
    void onRegistered(ConnectionEntry entry, boolean superseded);

    void onUnregistered(ConnectionEntry entry);
}
