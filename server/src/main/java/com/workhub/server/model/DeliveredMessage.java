package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Client-facing view of a message, built either from a live {@link RoutedMessage}
 * or from a {@link PersistedRecord}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveredMessage {

    @JsonProperty("messageId")
    String messageId;

    // Store sequence; only set on messages that came from history.
    @JsonProperty("recordId")
    Long recordId;

    @JsonProperty("senderId")
    String senderId;

    @JsonProperty("recipients")
    List<String> recipients;

    @JsonProperty("teamId")
    String teamId;

    @JsonProperty("kind")
    MessageKind kind;

    @JsonProperty("content")
    String content;

    @JsonProperty("timestamp")
    String timestamp; // ISO-8601 format

    public static DeliveredMessage live(RoutedMessage message) {
        return DeliveredMessage.builder()
                .messageId(message.getMessageId())
                .senderId(message.getSenderId())
                .recipients(recipientsOf(message.getRecipient()))
                .teamId(message.getTeamId())
                .kind(message.getKind())
                .content(message.getContent())
                .timestamp(message.getOriginTimestamp().toString())
                .build();
    }

    public static DeliveredMessage fromHistory(PersistedRecord record) {
        RecipientSelector recipient = record.getRecipient();
        return DeliveredMessage.builder()
                .messageId(record.getMessageId())
                .recordId(record.getRecordId())
                .senderId(record.getSenderId())
                .recipients(recipientsOf(recipient))
                .teamId(record.getTeamId())
                .kind(record.getKind())
                .content(record.getContent())
                .timestamp(record.getOriginTimestamp() != null ? record.getOriginTimestamp().toString() : null)
                .build();
    }

    /**
     * Stable identity used to drop a buffered live copy of a message that the
     * history fetch also returned.
     */
    @JsonIgnore
    public String identityKey() {
        if (messageId != null) {
            return "id:" + messageId;
        }
        return tupleKey();
    }

    @JsonIgnore
    public String tupleKey() {
        return "tuple:" + senderId + '|' + timestamp + '|' + content;
    }

    private static List<String> recipientsOf(RecipientSelector recipient) {
        if (recipient == null) {
            return null;
        }
        switch (recipient.getType()) {
            case USERS:
                return recipient.getUserIds();
            case ROLE_IN_TEAM:
                return List.of(recipient.getRole().name());
            case AGENT:
                return List.of(RecipientSelector.AGENT_ID);
            default:
                return null;
        }
    }
}
