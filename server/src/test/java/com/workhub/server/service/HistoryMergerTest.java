package com.workhub.server.service;

import com.workhub.server.model.DeliveredMessage;
import com.workhub.server.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryMergerTest {

    private static DeliveredMessage message(String id, Long recordId, String content, String timestamp) {
        return DeliveredMessage.builder()
                .messageId(id)
                .recordId(recordId)
                .senderId("m1")
                .kind(MessageKind.CHAT)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    @Test
    void keepsHistoryOrderThenAppendsUnseenBufferedMessages() {
        List<DeliveredMessage> history = List.of(
                message("a", 1L, "one", "2024-01-01T10:00:00Z"),
                message("b", 2L, "two", "2024-01-01T10:01:00Z"));
        List<DeliveredMessage> buffered = List.of(
                message("c", null, "three", "2024-01-01T10:02:00Z"),
                message("d", null, "four", "2024-01-01T10:03:00Z"));

        assertThat(HistoryMerger.merge(history, buffered)).extracting(DeliveredMessage::getMessageId)
                .containsExactly("a", "b", "c", "d");
    }

    @Test
    void dropsBufferedCopyOfMessageAlreadyInHistory() {
        DeliveredMessage stored = message("a", 7L, "hello", "2024-01-01T10:00:00Z");
        DeliveredMessage live = message("a", null, "hello", "2024-01-01T10:00:00Z");

        List<DeliveredMessage> merged = HistoryMerger.merge(List.of(stored), List.of(live));

        assertThat(merged).containsExactly(stored);
    }

    @Test
    void matchesLegacyRowsWithoutMessageIdByContentTuple() {
        DeliveredMessage legacy = message(null, 3L, "hello", "2024-01-01T10:00:00Z");
        DeliveredMessage live = message("x", null, "hello", "2024-01-01T10:00:00Z");

        assertThat(HistoryMerger.merge(List.of(legacy), List.of(live))).containsExactly(legacy);
    }

    @Test
    void sameContentWithDifferentIdsIsNotADuplicate() {
        DeliveredMessage first = message("a", 1L, "ok", "2024-01-01T10:00:00Z");
        DeliveredMessage second = message("b", null, "ok", "2024-01-01T10:00:00Z");

        assertThat(HistoryMerger.merge(List.of(first), List.of(second))).hasSize(2);
    }

    @Test
    void bufferedDuplicatesAmongThemselvesCollapse() {
        DeliveredMessage live = message("a", null, "hi", "2024-01-01T10:00:00Z");

        assertThat(HistoryMerger.merge(List.of(), List.of(live, live))).containsExactly(live);
    }
}
