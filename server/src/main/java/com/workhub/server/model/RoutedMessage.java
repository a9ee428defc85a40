package com.workhub.server.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A message on its way through the router. Immutable once built; the
 * {@code messageId} is shared by the live copy and the persisted copy.
 */
@Value
@Builder(toBuilder = true)
public class RoutedMessage {

    @NonNull
    @Builder.Default
    String messageId = UUID.randomUUID().toString();

    @NonNull
    String senderId;

    Role senderRole;

    String teamId;

    @NonNull
    String content;

    @NonNull
    MessageKind kind;

    @NonNull
    @Builder.Default
    Instant originTimestamp = Instant.now();

    @NonNull
    RecipientSelector recipient;

    // Temporary id the client used for optimistic display; echoed in acks.
    String clientMessageId;
}
