package com.workhub.server.service;

import com.workhub.server.model.HubEvent;
import com.workhub.server.model.MessageKind;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.RoutedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns backend events (incident reported, task assigned, permission decided)
 * into routed messages.
 */
@Service
@Slf4j
public class HubEventService {

    static final String SYSTEM_SENDER = "system";

    private final MessageRouter router;

    private final AtomicLong eventsReceived = new AtomicLong(0);

    public HubEventService(MessageRouter router) {
        this.router = router;
    }

    /**
     * @throws IllegalArgumentException if the event lacks what its type needs
     * @throws RoutingException         if the router rejects the resulting message
     */
    public RouteResult publish(HubEvent event) {
        eventsReceived.incrementAndGet();
        RoutedMessage message = toMessage(event);
        log.info("Routing {} event as {} message {}", event.getType(), message.getKind(), message.getMessageId());
        return router.route(message);
    }

    private RoutedMessage toMessage(HubEvent event) {
        if (event.getType() == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (event.getContent() == null || event.getContent().trim().isEmpty()) {
            throw new IllegalArgumentException("content is required");
        }
        requireTeam(event);

        RoutedMessage.RoutedMessageBuilder builder = RoutedMessage.builder()
                .content(event.getContent())
                .teamId(event.getTeamId());

        switch (event.getType()) {
            case INCIDENT_CREATED:
                return builder
                        .senderId(requireActor(event))
                        .kind(MessageKind.INCIDENT_ALERT)
                        .recipient(RecipientSelector.roleInTeam(Role.MANAGER, event.getTeamId()))
                        .build();
            case TASK_ASSIGNED:
                return builder
                        .senderId(requireActor(event))
                        .kind(MessageKind.TASK_NOTICE)
                        .recipient(RecipientSelector.users(requireRecipients(event)))
                        .build();
            case PERMISSION_DECIDED:
            case SYSTEM_NOTICE:
                return builder
                        .senderId(event.getActorId() != null ? event.getActorId() : SYSTEM_SENDER)
                        .kind(MessageKind.SYSTEM)
                        .recipient(RecipientSelector.users(requireRecipients(event)))
                        .build();
            default:
                throw new IllegalArgumentException("Unsupported event type " + event.getType());
        }
    }

    private static String requireActor(HubEvent event) {
        if (event.getActorId() == null || event.getActorId().trim().isEmpty()) {
            throw new IllegalArgumentException("actorId is required for " + event.getType());
        }
        return event.getActorId();
    }

    private static void requireTeam(HubEvent event) {
        if (event.getTeamId() == null || event.getTeamId().trim().isEmpty()) {
            throw new IllegalArgumentException("teamId is required for " + event.getType());
        }
    }

    private static List<String> requireRecipients(HubEvent event) {
        if (event.getRecipientIds() == null || event.getRecipientIds().isEmpty()) {
            throw new IllegalArgumentException("recipientIds are required for " + event.getType());
        }
        return event.getRecipientIds();
    }

    public long getEventsReceived() {
        return eventsReceived.get();
    }
}
