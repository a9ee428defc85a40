package com.workhub.server.service;

import com.workhub.server.agent.AgentGateway;
import com.workhub.server.agent.AgentRequest;
import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.DeliveredMessage;
import com.workhub.server.model.OutboundFrame;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.persistence.MessageStore;
import com.workhub.server.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a {@link RoutedMessage} into live pushes through the registry and
 * records in the message store.
 *
 * <p>Live delivery happens on the calling thread and never waits for storage.
 * Every routed message produces at least one store record, whether or not any
 * recipient was online, and every message belongs to a team.
 *
 * <p>Once storage has finished, recipients that were offline when the message
 * was routed are looked up again and pushed to if they have connected since.
 * Their history fetch may have run before the record existed.
 */
@Service
@Slf4j
public class MessageRouter {

    private final ConnectionRegistry registry;
    private final MessageStore messageStore;
    private final AgentGateway agentGateway;
    private final Executor persistenceExecutor;
    private final boolean mirrorAgentRepliesToManagers;

    private final AtomicLong messagesRouted = new AtomicLong(0);
    private final AtomicLong livePushes = new AtomicLong(0);
    private final AtomicLong offlineDeliveries = new AtomicLong(0);
    private final AtomicLong recordsPersisted = new AtomicLong(0);
    private final AtomicLong persistFailures = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final AtomicLong latePushes = new AtomicLong(0);

    public MessageRouter(ConnectionRegistry registry,
                         MessageStore messageStore,
                         AgentGateway agentGateway,
                         @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                         @Value("${hub.agent.notify-managers:true}") boolean mirrorAgentRepliesToManagers) {
        this.registry = registry;
        this.messageStore = messageStore;
        this.agentGateway = agentGateway;
        this.persistenceExecutor = persistenceExecutor;
        this.mirrorAgentRepliesToManagers = mirrorAgentRepliesToManagers;
    }

    /**
     * Route one message.
     *
     * @throws RoutingException if the message has no team, is addressed in a way
     *                          its kind does not allow, or to a user of another team
     */
    public RouteResult route(RoutedMessage message) {
        requireTeam(message);
        DeliveryPlan plan = plan(message);
        messagesRouted.incrementAndGet();

        int pushed = pushLive(message, plan.liveTargets);
        if (pushed < plan.expectedRecipients) {
            offlineDeliveries.addAndGet(plan.expectedRecipients - pushed);
        }

        CompletableFuture<Void> forwarded = plan.forwardToAgent
                ? forwardToAgent(message)
                : CompletableFuture.completedFuture(null);

        CompletableFuture<List<Long>> persisted = persistAsync(message, plan.records);
        if (plan.hasLateCandidates()) {
            persisted.whenComplete((ids, error) -> deliverLate(message, plan));
        }

        log.debug("Routed {} message {} from {}: live={}, records={}, agent={}",
                message.getKind(), message.getMessageId(), message.getSenderId(),
                pushed, plan.records.size(), plan.forwardToAgent);

        return new RouteResult(message.getMessageId(), message.getClientMessageId(), pushed, persisted, forwarded);
    }

    private DeliveryPlan plan(RoutedMessage message) {
        RecipientSelector recipient = message.getRecipient();
        return switch (message.getKind()) {
            case CHAT -> planChat(message, recipient);
            case INCIDENT_ALERT -> planTeamBroadcast(message, Role.MANAGER);
            case TASK_NOTICE, SYSTEM -> planPerUser(message, recipient);
            case AGENT_RESPONSE -> planAgentResponse(message, recipient);
        };
    }

    private DeliveryPlan planChat(RoutedMessage message, RecipientSelector recipient) {
        switch (recipient.getType()) {
            case AGENT:
                return new DeliveryPlan(List.of(), 0, List.of(RecipientSelector.agent()), true);
            case USERS:
                String target = recipient.singleUser();
                List<HubChannel> live = new ArrayList<>();
                List<String> offline = new ArrayList<>();
                collectTarget(message, target, live, offline);
                return new DeliveryPlan(live, 1, List.of(RecipientSelector.user(target)), false)
                        .lateFor(offline, null);
            default:
                throw reject(message, "chat must address one user or the agent");
        }
    }

    private DeliveryPlan planTeamBroadcast(RoutedMessage message, Role role) {
        String teamId = requireTeam(message);
        HubChannel senderChannel = registry.lookup(message.getSenderId()).orElse(null);
        List<HubChannel> live = new ArrayList<>();
        for (HubChannel channel : registry.allInRoleAndTeam(role, teamId)) {
            if (channel != senderChannel) {
                live.add(channel);
            }
        }
        return new DeliveryPlan(live, live.size(), List.of(RecipientSelector.roleInTeam(role, teamId)), false)
                .lateFor(List.of(), role);
    }

    private DeliveryPlan planPerUser(RoutedMessage message, RecipientSelector recipient) {
        if (recipient.getType() != RecipientSelector.Type.USERS) {
            throw reject(message, message.getKind() + " must address explicit users");
        }
        Set<String> targets = new LinkedHashSet<>(recipient.getUserIds());
        List<HubChannel> live = new ArrayList<>();
        List<String> offline = new ArrayList<>();
        List<RecipientSelector> records = new ArrayList<>();
        for (String target : targets) {
            collectTarget(message, target, live, offline);
            records.add(RecipientSelector.user(target));
        }
        return new DeliveryPlan(live, targets.size(), records, false).lateFor(offline, null);
    }

    private DeliveryPlan planAgentResponse(RoutedMessage message, RecipientSelector recipient) {
        if (recipient.getType() != RecipientSelector.Type.USERS) {
            throw reject(message, "agent_response must address the originating user");
        }
        String worker = recipient.singleUser();
        List<HubChannel> live = new ArrayList<>();
        List<String> offline = new ArrayList<>();
        collectTarget(message, worker, live, offline);

        int expected = 1;
        if (mirrorAgentRepliesToManagers) {
            for (HubChannel channel : registry.allInRoleAndTeam(Role.MANAGER, message.getTeamId())) {
                if (!live.contains(channel)) {
                    live.add(channel);
                    expected++;
                }
            }
        }
        return new DeliveryPlan(live, expected, List.of(RecipientSelector.user(worker)), false)
                .lateFor(offline, null);
    }

    private void collectTarget(RoutedMessage message, String userId, List<HubChannel> live, List<String> offline) {
        Optional<HubChannel> channel = lookupInTeam(message, userId);
        if (channel.isPresent()) {
            live.add(channel.get());
        } else {
            offline.add(userId);
        }
    }

    /**
     * Live channel of {@code userId}, if connected. A connected user of another
     * team is a routing error; an offline user is not.
     */
    private Optional<HubChannel> lookupInTeam(RoutedMessage message, String userId) {
        Optional<ConnectionEntry> entry = registry.entry(userId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!message.getTeamId().equals(entry.get().getTeamId())) {
            throw reject(message, "recipient " + userId + " is not in team " + message.getTeamId());
        }
        return Optional.of(entry.get().getChannel());
    }

    private int pushLive(RoutedMessage message, List<HubChannel> targets) {
        if (targets.isEmpty()) {
            return 0;
        }

        OutboundFrame frame = OutboundFrame.message(DeliveredMessage.live(message));
        int pushed = 0;
        for (HubChannel channel : targets) {
            if (channel.send(frame)) {
                pushed++;
            } else {
                log.debug("Live push of message {} to channel {} not accepted", message.getMessageId(), channel.getId());
            }
        }
        livePushes.addAndGet(pushed);
        return pushed;
    }

    /**
     * Push to recipients that connected between planning and the end of
     * storage. Runs whether or not storage succeeded. Connections that already
     * hold the message drop the repeat.
     */
    private void deliverLate(RoutedMessage message, DeliveryPlan plan) {
        try {
            List<HubChannel> late = new ArrayList<>();
            for (String userId : plan.offlineUsers) {
                registry.entry(userId)
                        .filter(entry -> message.getTeamId().equals(entry.getTeamId()))
                        .map(ConnectionEntry::getChannel)
                        .ifPresent(late::add);
            }
            if (plan.broadcastRole != null) {
                HubChannel senderChannel = registry.lookup(message.getSenderId()).orElse(null);
                for (HubChannel channel : registry.allInRoleAndTeam(plan.broadcastRole, message.getTeamId())) {
                    if (channel != senderChannel && !plan.liveTargets.contains(channel)) {
                        late.add(channel);
                    }
                }
            }
            if (late.isEmpty()) {
                return;
            }
            int pushed = pushLive(message, late);
            latePushes.addAndGet(pushed);
            log.debug("Late push of message {} reached {} of {} newly connected recipients",
                    message.getMessageId(), pushed, late.size());
        } catch (RuntimeException e) {
            log.error("Late delivery of message {} failed: {}", message.getMessageId(), e.getMessage(), e);
        }
    }

    private CompletableFuture<Void> forwardToAgent(RoutedMessage message) {
        AgentRequest request = new AgentRequest(
                message.getMessageId(),
                message.getSenderId(),
                message.getTeamId(),
                message.getContent(),
                message.getOriginTimestamp().toString());
        try {
            return agentGateway.submit(request);
        } catch (RuntimeException e) {
            log.error("Agent hand-off failed for message {}: {}", message.getMessageId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<List<Long>> persistAsync(RoutedMessage message, List<RecipientSelector> records) {
        CompletableFuture<List<Long>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> persistAll(message, records), persistenceExecutor);
        } catch (RejectedExecutionException e) {
            persistFailures.incrementAndGet();
            log.error("Persistence executor rejected message {}: {}", message.getMessageId(), e.getMessage());
            return CompletableFuture.failedFuture(
                    new PersistenceException("Storage unavailable for message " + message.getMessageId(), e));
        }
        return future.whenComplete((ids, error) -> {
            if (error != null) {
                persistFailures.incrementAndGet();
                log.error("Message {} from {} was not stored: {}",
                        message.getMessageId(), message.getSenderId(), error.getMessage());
            } else {
                recordsPersisted.addAndGet(ids.size());
            }
        });
    }

    private List<Long> persistAll(RoutedMessage message, List<RecipientSelector> records) {
        List<Long> ids = new ArrayList<>(records.size());
        for (RecipientSelector record : records) {
            ids.add(messageStore.persist(message, record));
        }
        return ids;
    }

    private String requireTeam(RoutedMessage message) {
        if (message.getTeamId() == null) {
            throw reject(message, message.getKind() + " requires a team");
        }
        return message.getTeamId();
    }

    private RoutingException reject(RoutedMessage message, String reason) {
        rejected.incrementAndGet();
        log.warn("Rejected {} message {} from {}: {}",
                message.getKind(), message.getMessageId(), message.getSenderId(), reason);
        return new RoutingException(reason);
    }

    public long getMessagesRouted() {
        return messagesRouted.get();
    }

    public long getLivePushes() {
        return livePushes.get();
    }

    public long getOfflineDeliveries() {
        return offlineDeliveries.get();
    }

    public long getRecordsPersisted() {
        return recordsPersisted.get();
    }

    public long getPersistFailures() {
        return persistFailures.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public long getLatePushes() {
        return latePushes.get();
    }

    private static final class DeliveryPlan {
        final List<HubChannel> liveTargets;
        final int expectedRecipients;
        final List<RecipientSelector> records;
        final boolean forwardToAgent;
        // user targets with no live channel at planning time
        List<String> offlineUsers = List.of();
        // role whose team members are looked up again after storage
        Role broadcastRole;

        DeliveryPlan(List<HubChannel> liveTargets, int expectedRecipients,
                     List<RecipientSelector> records, boolean forwardToAgent) {
            this.liveTargets = liveTargets;
            this.expectedRecipients = expectedRecipients;
            this.records = records;
            this.forwardToAgent = forwardToAgent;
        }

        DeliveryPlan lateFor(List<String> offlineUsers, Role broadcastRole) {
            this.offlineUsers = offlineUsers;
            this.broadcastRole = broadcastRole;
            return this;
        }

        boolean hasLateCandidates() {
            return !offlineUsers.isEmpty() || broadcastRole != null;
        }
    }
}
