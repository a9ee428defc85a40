package com.workhub.server.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workhub.server.agent.AgentUnavailableException;
import com.workhub.server.model.InboundFrame;
import com.workhub.server.model.OutboundFrame;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.model.UserIdentity;
import com.workhub.server.service.ConnectionRegistry;
import com.workhub.server.service.HistoryReconciler;
import com.workhub.server.service.HubChannel;
import com.workhub.server.service.MessageRouter;
import com.workhub.server.service.RouteResult;
import com.workhub.server.service.RoutingException;
import com.workhub.server.service.WebSocketWriteManager;
import com.workhub.server.validator.FrameValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket endpoint for workers and managers. Frames of one session are
 * handled one at a time, so a sender's messages are routed in the order sent.
 */
@Component
@Slf4j
public class HubWebSocketHandler extends TextWebSocketHandler {

    static final String CHANNEL_ATTRIBUTE = "hubChannel";

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final HistoryReconciler reconciler;
    private final MessageRouter router;
    private final WebSocketWriteManager writeManager;
    private final FrameValidator validator;

    private final AtomicLong connectionsOpened = new AtomicLong(0);
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong framesRejected = new AtomicLong(0);
    private final AtomicLong acksSent = new AtomicLong(0);
    private final AtomicLong storageErrorsReported = new AtomicLong(0);

    public HubWebSocketHandler(ObjectMapper objectMapper,
                               ConnectionRegistry registry,
                               HistoryReconciler reconciler,
                               MessageRouter router,
                               WebSocketWriteManager writeManager,
                               FrameValidator validator) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.reconciler = reconciler;
        this.router = router;
        this.writeManager = writeManager;
        this.validator = validator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        UserIdentity identity = identityOf(session);
        if (identity == null) {
            log.warn("WebSocket session {} has no identity, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        writeManager.registerSession(session, () -> disconnect(session, "write failure"));

        WebSocketChannel transport = new WebSocketChannel(session, writeManager, objectMapper);
        HistoryReconciler.Connection connection = reconciler.connect(identity, transport);
        session.getAttributes().put(CHANNEL_ATTRIBUTE, connection.getChannel());
        connectionsOpened.incrementAndGet();

        log.info("WebSocket connection established: sessionId={}, userId={}, role={}, teamId={}, superseded={}",
                session.getId(), identity.getUserId(), identity.getRole(), identity.getTeamId(),
                connection.getRegistration().isSuperseded());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        framesReceived.incrementAndGet();

        UserIdentity sender = identityOf(session);
        HubChannel channel = channelOf(session);
        if (sender == null || channel == null) {
            log.error("Frame on unregistered session {}", session.getId());
            return;
        }

        InboundFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), InboundFrame.class);
        } catch (Exception e) {
            log.warn("Unparseable frame from user {}: {}", sender.getUserId(), e.getMessage());
            reject(channel, null, "Invalid message format");
            return;
        }

        String error = validator.validate(frame, sender);
        if (error != null) {
            log.warn("Invalid frame from user {}: {}", sender.getUserId(), error);
            reject(channel, frame.getClientMessageId(), error);
            return;
        }

        RoutedMessage routed = toRoutedMessage(frame, sender);
        RouteResult result;
        try {
            result = router.route(routed);
        } catch (RoutingException e) {
            reject(channel, frame.getClientMessageId(), e.getMessage());
            return;
        }

        reportOutcome(channel, result);
    }

    /**
     * Tell the sender whether the message was stored, and whether the agent got
     * it. Runs when storage completes; live delivery has already happened.
     */
    private void reportOutcome(HubChannel channel, RouteResult result) {
        result.getPersisted().whenComplete((recordIds, error) -> {
            if (error != null) {
                storageErrorsReported.incrementAndGet();
                channel.send(OutboundFrame.error(result.getMessageId(), result.getClientMessageId(),
                        "Message was not stored"));
            } else if (channel.send(OutboundFrame.ack(result.getMessageId(), result.getClientMessageId(), recordIds))) {
                acksSent.incrementAndGet();
            }
        });

        result.getAgentForwarded().whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                String reason = cause instanceof AgentUnavailableException
                        ? cause.getMessage() : "The assistant could not be reached";
                channel.send(OutboundFrame.error(result.getMessageId(), result.getClientMessageId(), reason));
            }
        });
    }

    private RoutedMessage toRoutedMessage(InboundFrame frame, UserIdentity sender) {
        RecipientSelector recipient;
        switch (frame.getKind()) {
            case CHAT:
                recipient = RecipientSelector.AGENT_ID.equals(frame.getTo())
                        ? RecipientSelector.agent()
                        : RecipientSelector.user(frame.getTo());
                break;
            case TASK_NOTICE:
                recipient = RecipientSelector.users(frame.getAssignees());
                break;
            case INCIDENT_ALERT:
                recipient = RecipientSelector.roleInTeam(Role.MANAGER, sender.getTeamId());
                break;
            default:
                throw new IllegalStateException("Unexpected client kind " + frame.getKind());
        }

        return RoutedMessage.builder()
                .senderId(sender.getUserId())
                .senderRole(sender.getRole())
                .teamId(sender.getTeamId())
                .kind(frame.getKind())
                .content(frame.getContent())
                .recipient(recipient)
                .clientMessageId(frame.getClientMessageId())
                .build();
    }

    private void reject(HubChannel channel, String clientMessageId, String error) {
        framesRejected.incrementAndGet();
        channel.send(OutboundFrame.error(null, clientMessageId, error));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        log.info("WebSocket connection closed: sessionId={}, status={}", session.getId(), status);
        disconnect(session, "closed");
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        disconnect(session, "transport error");
    }

    private void disconnect(WebSocketSession session, String reason) {
        UserIdentity identity = identityOf(session);
        HubChannel channel = channelOf(session);
        if (identity != null && channel != null && registry.unregister(identity.getUserId(), channel)) {
            log.debug("User {} disconnected ({})", identity.getUserId(), reason);
        }
        writeManager.unregisterSession(session.getId());
    }

    private static UserIdentity identityOf(WebSocketSession session) {
        return (UserIdentity) session.getAttributes().get(IdentityHandshakeInterceptor.IDENTITY_ATTRIBUTE);
    }

    private static HubChannel channelOf(WebSocketSession session) {
        return (HubChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
    }

    public long getConnectionsOpened() {
        return connectionsOpened.get();
    }

    public long getFramesReceived() {
        return framesReceived.get();
    }

    public long getFramesRejected() {
        return framesRejected.get();
    }

    public long getAcksSent() {
        return acksSent.get();
    }

    public long getStorageErrorsReported() {
        return storageErrorsReported.get();
    }
}
