package com.workhub.server.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A message as the store returns it.
 */
@Value
@Builder
public class PersistedRecord {
    long recordId;
    // Null for rows written before the hub assigned message ids.
    String messageId;
    String senderId;
    RecipientSelector recipient;
    String teamId;
    MessageKind kind;
    String content;
    Instant originTimestamp;
}
