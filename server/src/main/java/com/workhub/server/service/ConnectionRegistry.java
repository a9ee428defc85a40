package com.workhub.server.service;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.OutboundFrame;
import com.workhub.server.model.RegistrationResult;
import com.workhub.server.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the mapping from user id to the user's single live channel.
 *
 * <p>Mutations for one user are serialized by one of a fixed set of striped
 * locks, so lock memory does not grow with the number of users ever seen. The
 * locks are reentrant because closing a superseded channel can synchronously
 * run the transport's close callback, which calls {@link #unregister} on the
 * same thread. Reads never lock.
 */
@Service
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, ConnectionEntry> entries = new ConcurrentHashMap<>();

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] userLocks = new ReentrantLock[LOCK_STRIPES];

    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong registrations = new AtomicLong(0);
    private final AtomicLong supersessions = new AtomicLong(0);
    private final AtomicLong unregistrations = new AtomicLong(0);
    private final AtomicLong staleUnregisters = new AtomicLong(0);

    public ConnectionRegistry() {
        for (int i = 0; i < userLocks.length; i++) {
            userLocks[i] = new ReentrantLock();
        }
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    /**
     * Install a live connection. A previous connection of the same user is
     * removed and closed before the new entry becomes visible.
     */
    public RegistrationResult register(ConnectionEntry entry) {
        if (!entry.getChannel().isOpen()) {
            throw new IllegalArgumentException("Channel " + entry.getChannel().getId() + " is not open");
        }

        String userId = entry.getUserId();
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            ConnectionEntry previous = entries.remove(userId);
            boolean superseded = previous != null;

            if (superseded) {
                log.info("Superseding connection for user {}: old channel={}, new channel={}",
                        userId, previous.getChannel().getId(), entry.getChannel().getId());
                closeQuietly(previous);
                supersessions.incrementAndGet();
            }

            entries.put(userId, entry);
            registrations.incrementAndGet();

            log.debug("Registered user {} (role={}, team={}) on channel {}",
                    userId, entry.getRole(), entry.getTeamId(), entry.getChannel().getId());

            notifyRegistered(entry, superseded);
            return new RegistrationResult(entry, superseded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the user's entry, but only if it still holds {@code channel}. A late
     * close callback from a superseded channel is ignored.
     *
     * @return true if an entry was removed
     */
    public boolean unregister(String userId, HubChannel channel) {
        if (userId == null || channel == null) {
            return false;
        }

        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            ConnectionEntry current = entries.get(userId);
            if (current == null || current.getChannel() != channel) {
                staleUnregisters.incrementAndGet();
                log.debug("Ignoring unregister for user {} on channel {}: not the live channel",
                        userId, channel.getId());
                return false;
            }

            entries.remove(userId);
            unregistrations.incrementAndGet();
            log.debug("Unregistered user {} from channel {}", userId, channel.getId());

            notifyUnregistered(current);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<HubChannel> lookup(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        ConnectionEntry entry = entries.get(userId);
        return entry != null ? Optional.of(entry.getChannel()) : Optional.empty();
    }

    public Optional<ConnectionEntry> entry(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(entries.get(userId));
    }

    /**
     * Snapshot of the channels of every connected user with the given role in
     * the given team. Connections made after the snapshot are not included.
     */
    public List<HubChannel> allInRoleAndTeam(Role role, String teamId) {
        List<HubChannel> channels = new ArrayList<>();
        for (ConnectionEntry entry : entries.values()) {
            if (entry.getRole() == role && entry.getTeamId().equals(teamId)) {
                channels.add(entry.getChannel());
            }
        }
        return channels;
    }

    /**
     * Snapshot of the connected members of a team.
     */
    public List<ConnectionEntry> connectedInTeam(String teamId) {
        List<ConnectionEntry> members = new ArrayList<>();
        for (ConnectionEntry entry : entries.values()) {
            if (entry.getTeamId().equals(teamId)) {
                members.add(entry);
            }
        }
        return members;
    }

    public int size() {
        return entries.size();
    }

    private ReentrantLock lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), userLocks.length)];
    }

    int lockCount() {
        return userLocks.length;
    }

    private void closeQuietly(ConnectionEntry previous) {
        HubChannel channel = previous.getChannel();
        try {
            channel.send(OutboundFrame.superseded());
            channel.close();
        } catch (Exception e) {
            log.warn("Failed to close superseded channel {} for user {}: {}",
                    channel.getId(), previous.getUserId(), e.getMessage());
        }
    }

    private void notifyRegistered(ConnectionEntry entry, boolean superseded) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onRegistered(entry, superseded);
            } catch (Exception e) {
                log.error("Registry listener {} failed on register of user {}: {}",
                        listener.getClass().getSimpleName(), entry.getUserId(), e.getMessage(), e);
            }
        }
    }

    private void notifyUnregistered(ConnectionEntry entry) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onUnregistered(entry);
            } catch (Exception e) {
                log.error("Registry listener {} failed on unregister of user {}: {}",
                        listener.getClass().getSimpleName(), entry.getUserId(), e.getMessage(), e);
            }
        }
    }

    public long getRegistrations() {
        return registrations.get();
    }

    public long getSupersessions() {
        return supersessions.get();
    }

    public long getUnregistrations() {
        return unregistrations.get();
    }

    public long getStaleUnregisters() {
        return staleUnregisters.get();
    }
}
