package com.workhub.server.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.PresenceState;
import com.workhub.server.model.PresenceStatus;
import com.workhub.server.model.Role;
import com.workhub.server.model.UserIdentity;
import com.workhub.server.support.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceTrackerTest {

    private static final UserIdentity WORKER = new UserIdentity("w1", Role.WORKER, "t1");

    private ConnectionRegistry registry;
    private PresenceTracker tracker;
    private List<PresenceState> changes;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        tracker = new PresenceTracker(registry, Caffeine.newBuilder().build());
        changes = new ArrayList<>();
        tracker.onPresenceChange((state, entry) -> changes.add(state));
    }

    @Test
    void unknownUserIsOfflineWithoutTransitionTime() {
        PresenceState state = tracker.presence("nobody");

        assertThat(state.getStatus()).isEqualTo(PresenceStatus.OFFLINE);
        assertThat(state.getLastTransitionTime()).isNull();
    }

    @Test
    void registerAndUnregisterFireOnlineThenOffline() {
        RecordingChannel channel = new RecordingChannel();

        registry.register(ConnectionEntry.of(WORKER, channel));
        assertThat(tracker.isOnline("w1")).isTrue();

        registry.unregister("w1", channel);
        assertThat(tracker.isOnline("w1")).isFalse();

        assertThat(changes).extracting(PresenceState::getStatus)
                .containsExactly(PresenceStatus.ONLINE, PresenceStatus.OFFLINE);
        assertThat(tracker.presence("w1").getLastTransitionTime()).isNotNull();
    }

    @Test
    void supersedingConnectionIsNotATransition() {
        registry.register(ConnectionEntry.of(WORKER, new RecordingChannel()));
        registry.register(ConnectionEntry.of(WORKER, new RecordingChannel()));

        assertThat(changes).extracting(PresenceState::getStatus).containsExactly(PresenceStatus.ONLINE);
        assertThat(tracker.isOnline("w1")).isTrue();
    }

    @Test
    void staleUnregisterDoesNotReportOffline() {
        RecordingChannel old = new RecordingChannel();
        registry.register(ConnectionEntry.of(WORKER, old));
        registry.register(ConnectionEntry.of(WORKER, new RecordingChannel()));

        registry.unregister("w1", old);

        assertThat(tracker.isOnline("w1")).isTrue();
        assertThat(changes).extracting(PresenceState::getStatus).containsExactly(PresenceStatus.ONLINE);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<PresenceState> second = new ArrayList<>();
        tracker.onPresenceChange((state, entry) -> {
            throw new IllegalStateException("boom");
        });
        tracker.onPresenceChange((state, entry) -> second.add(state));

        registry.register(ConnectionEntry.of(WORKER, new RecordingChannel()));

        assertThat(changes).hasSize(1);
        assertThat(second).hasSize(1);
    }

    @Test
    void transitionTimesAreBoundedAcrossManyUsers() {
        Cache<String, Instant> transitions = Caffeine.newBuilder()
                .maximumSize(100)
                .executor(Runnable::run)
                .build();
        ConnectionRegistry busy = new ConnectionRegistry();
        PresenceTracker bounded = new PresenceTracker(busy, transitions);

        for (int i = 0; i < 5_000; i++) {
            RecordingChannel channel = new RecordingChannel();
            busy.register(ConnectionEntry.of(new UserIdentity("u" + i, Role.WORKER, "t1"), channel));
            busy.unregister("u" + i, channel);
        }
        transitions.cleanUp();

        assertThat(bounded.trackedTransitions()).isLessThanOrEqualTo(100);
    }
}
