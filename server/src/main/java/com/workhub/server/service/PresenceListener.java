package com.workhub.server.service;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.PresenceState;

@FunctionalInterface
public interface PresenceListener {

    /**
     * Called synchronously when a user goes online or offline.
     *
     * @param state the new state
     * @param entry the connection that came or went
     */
    void onPresenceChange(PresenceState state, ConnectionEntry entry);
}
