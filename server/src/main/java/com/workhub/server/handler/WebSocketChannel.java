package com.workhub.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workhub.server.model.OutboundFrame;
import com.workhub.server.service.HubChannel;
import com.workhub.server.service.WebSocketWriteManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

/**
 * {@link HubChannel} over a Spring WebSocket session. Writes go through the
 * {@link WebSocketWriteManager} so they are serialized per session.
 */
@Slf4j
public class WebSocketChannel implements HubChannel {

    private final WebSocketSession session;
    private final WebSocketWriteManager writeManager;
    private final ObjectMapper objectMapper;

    public WebSocketChannel(WebSocketSession session, WebSocketWriteManager writeManager, ObjectMapper objectMapper) {
        this.session = session;
        this.writeManager = writeManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public boolean send(OutboundFrame frame) {
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame for session {}: {}", frame.getType(), session.getId(), e.getMessage());
            return false;
        }
        return writeManager.sendMessage(session, json);
    }

    // Frames queued before the close are still written.
    @Override
    public void close() {
        writeManager.closeAfterDrain(session, CloseStatus.POLICY_VIOLATION.withReason("superseded"));
    }

    WebSocketSession getSession() {
        return session;
    }
}
