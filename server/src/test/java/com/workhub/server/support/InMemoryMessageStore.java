package com.workhub.server.support;

import com.workhub.server.model.MessageKind;
import com.workhub.server.model.PersistedRecord;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.model.UserIdentity;
import com.workhub.server.persistence.MessageStore;
import com.workhub.server.persistence.PersistenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * List-backed store with switchable failures.
 */
public class InMemoryMessageStore implements MessageStore {

    private final List<PersistedRecord> records = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean failPersist = false;
    private volatile boolean failHistory = false;

    @Override
    public synchronized long persist(RoutedMessage message, RecipientSelector recipient) {
        if (failPersist) {
            throw new PersistenceException("store is down");
        }
        long id = sequence.incrementAndGet();
        records.add(PersistedRecord.builder()
                .recordId(id)
                .messageId(message.getMessageId())
                .senderId(message.getSenderId())
                .recipient(recipient)
                .teamId(recipient.getTeamId() != null ? recipient.getTeamId() : message.getTeamId())
                .kind(message.getKind() == MessageKind.AGENT_RESPONSE ? MessageKind.CHAT : message.getKind())
                .content(message.getContent())
                .originTimestamp(message.getOriginTimestamp())
                .build());
        return id;
    }

    @Override
    public synchronized List<PersistedRecord> fetchHistory(UserIdentity user, int limit) {
        if (failHistory) {
            throw new PersistenceException("history is down");
        }
        List<PersistedRecord> visible = new ArrayList<>();
        for (PersistedRecord record : records) {
            if (!record.getTeamId().equals(user.getTeamId())) {
                continue;
            }
            RecipientSelector to = record.getRecipient();
            boolean addressed = to.getType() == RecipientSelector.Type.USERS && to.getUserIds().contains(user.getUserId());
            boolean broadcast = to.getType() == RecipientSelector.Type.ROLE_IN_TEAM
                    && to.getRole() == user.getRole() && to.getTeamId().equals(user.getTeamId());
            if (addressed || broadcast || record.getSenderId().equals(user.getUserId())) {
                visible.add(record);
            }
        }
        int from = Math.max(0, visible.size() - limit);
        return new ArrayList<>(visible.subList(from, visible.size()));
    }

    public synchronized List<PersistedRecord> records() {
        return new ArrayList<>(records);
    }

    public void setFailPersist(boolean failPersist) {
        this.failPersist = failPersist;
    }

    public void setFailHistory(boolean failHistory) {
        this.failHistory = failHistory;
    }
}
