package com.workhub.server.listener;

import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.OutboundFrame;
import com.workhub.server.model.PresenceState;
import com.workhub.server.model.Role;
import com.workhub.server.service.ConnectionRegistry;
import com.workhub.server.service.HubChannel;
import com.workhub.server.service.PresenceTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes presence changes of team members to the team's connected managers,
 * which drives the dashboard's live-connected indicator.
 */
@Component
@Slf4j
public class DashboardPresencePublisher {

    private final ConnectionRegistry registry;

    private final AtomicLong presenceFramesSent = new AtomicLong(0);

    public DashboardPresencePublisher(ConnectionRegistry registry, PresenceTracker presenceTracker) {
        this.registry = registry;
        presenceTracker.onPresenceChange(this::publish);
    }

    void publish(PresenceState state, ConnectionEntry entry) {
        OutboundFrame frame = OutboundFrame.presence(state);
        int sent = 0;
        for (HubChannel manager : registry.allInRoleAndTeam(Role.MANAGER, entry.getTeamId())) {
            if (manager == entry.getChannel()) {
                continue;
            }
            if (manager.send(frame)) {
                sent++;
            }
        }
        presenceFramesSent.addAndGet(sent);
        log.debug("Published {} presence of user {} to {} managers of team {}",
                state.getStatus(), state.getUserId(), sent, entry.getTeamId());
    }

    public long getPresenceFramesSent() {
        return presenceFramesSent.get();
    }
}
