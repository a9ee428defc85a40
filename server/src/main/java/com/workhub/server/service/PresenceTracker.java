package com.workhub.server.service;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.PresenceState;
import com.workhub.server.model.PresenceStatus;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Online/offline view over the {@link ConnectionRegistry}. Status is always read
 * from the registry; only the time of the last transition is kept here, in a
 * bounded cache.
 */
@Service
@Slf4j
public class PresenceTracker implements RegistryListener {

    private final ConnectionRegistry registry;

    private final Cache<String, Instant> lastTransitions;

    private final List<PresenceListener> listeners = new CopyOnWriteArrayList<>();

    public PresenceTracker(ConnectionRegistry registry,
                           @Qualifier("presenceTransitionsCache") Cache<String, Instant> lastTransitions) {
        this.registry = registry;
        this.lastTransitions = lastTransitions;
        registry.addListener(this);
    }

    public boolean isOnline(String userId) {
        return registry.lookup(userId).isPresent();
    }

    public PresenceState presence(String userId) {
        Instant last = lastTransitions.getIfPresent(userId);
        return new PresenceState(userId, statusOf(userId), last != null ? last.toString() : null);
    }

    public void onPresenceChange(PresenceListener listener) {
        listeners.add(listener);
    }

    // Replacing a connection of an already online user is not a transition.
    @Override
    public void onRegistered(ConnectionEntry entry, boolean superseded) {
        if (!superseded) {
            transition(entry);
        }
    }

    @Override
    public void onUnregistered(ConnectionEntry entry) {
        transition(entry);
    }

    private void transition(ConnectionEntry entry) {
        String userId = entry.getUserId();
        Instant now = Instant.now();
        lastTransitions.put(userId, now);

        PresenceState state = new PresenceState(userId, statusOf(userId), now.toString());
        log.info("User {} (team {}) is now {}", userId, entry.getTeamId(), state.getStatus());

        for (PresenceListener listener : listeners) {
            try {
                listener.onPresenceChange(state, entry);
            } catch (Exception e) {
                log.error("Presence listener failed for user {}: {}", userId, e.getMessage(), e);
            }
        }
    }

    long trackedTransitions() {
        return lastTransitions.estimatedSize();
    }

    private PresenceStatus statusOf(String userId) {
        return isOnline(userId) ? PresenceStatus.ONLINE : PresenceStatus.OFFLINE;
    }
}
