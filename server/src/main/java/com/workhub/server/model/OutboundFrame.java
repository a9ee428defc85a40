package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Frame pushed to a connected client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundFrame {

    public enum Type {
        @JsonProperty("message") MESSAGE,
        @JsonProperty("history") HISTORY,
        @JsonProperty("presence") PRESENCE,
        @JsonProperty("ack") ACK,
        @JsonProperty("error") ERROR,
        @JsonProperty("superseded") SUPERSEDED
    }

    @JsonProperty("type")
    private Type type;

    @JsonProperty("message")
    private DeliveredMessage message;

    @JsonProperty("messages")
    private List<DeliveredMessage> messages;

    @JsonProperty("historyAvailable")
    private Boolean historyAvailable;

    @JsonProperty("presence")
    private PresenceState presence;

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("clientMessageId")
    private String clientMessageId;

    @JsonProperty("recordIds")
    private List<Long> recordIds;

    @JsonProperty("error")
    private String error;

    @JsonProperty("serverTimestamp")
    private String serverTimestamp;

    public static OutboundFrame message(DeliveredMessage message) {
        return OutboundFrame.builder()
                .type(Type.MESSAGE)
                .message(message)
                .build();
    }

    public static OutboundFrame history(List<DeliveredMessage> messages, boolean historyAvailable) {
        return OutboundFrame.builder()
                .type(Type.HISTORY)
                .messages(messages)
                .historyAvailable(historyAvailable)
                .serverTimestamp(Instant.now().toString())
                .build();
    }

    public static OutboundFrame presence(PresenceState presence) {
        return OutboundFrame.builder()
                .type(Type.PRESENCE)
                .presence(presence)
                .build();
    }

    public static OutboundFrame ack(String messageId, String clientMessageId, List<Long> recordIds) {
        return OutboundFrame.builder()
                .type(Type.ACK)
                .messageId(messageId)
                .clientMessageId(clientMessageId)
                .recordIds(recordIds)
                .serverTimestamp(Instant.now().toString())
                .build();
    }

    public static OutboundFrame error(String messageId, String clientMessageId, String error) {
        return OutboundFrame.builder()
                .type(Type.ERROR)
                .messageId(messageId)
                .clientMessageId(clientMessageId)
                .error(error)
                .serverTimestamp(Instant.now().toString())
                .build();
    }

    public static OutboundFrame superseded() {
        return OutboundFrame.builder()
                .type(Type.SUPERSEDED)
                .error("Signed in from another connection")
                .serverTimestamp(Instant.now().toString())
                .build();
    }
}
