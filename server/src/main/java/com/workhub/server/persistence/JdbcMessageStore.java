package com.workhub.server.persistence;

import com.workhub.server.model.MessageKind;
import com.workhub.server.model.PersistedRecord;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MessageStore} over the {@code hub_messages} table.
 *
 * <p>Broadcasts are stored once with a role/team recipient rather than once per
 * member, so members who were offline still see them in their history.
 */
@Repository
@Slf4j
public class JdbcMessageStore implements MessageStore {

    private static final String INSERT_MESSAGE = "INSERT INTO hub_messages (message_id, sender_id, " +
            "recipient_type, recipient_user_id, recipient_role, recipient_team_id, kind, content, origin_timestamp) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    /**
     * Most recent records first; reversed after reading so callers get oldest
     * first. Ties on timestamp fall back to the insert sequence.
     */
    private static final String SELECT_HISTORY = "SELECT id, message_id, sender_id, recipient_type, " +
            "recipient_user_id, recipient_role, recipient_team_id, kind, content, origin_timestamp " +
            "FROM hub_messages " +
            "WHERE recipient_team_id = ? " +
            "AND (recipient_user_id = ? " +
            "OR sender_id = ? " +
            "OR (recipient_type = 'ROLE_IN_TEAM' AND recipient_role = ?)) " +
            "ORDER BY origin_timestamp DESC, id DESC " +
            "LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    private final AtomicLong recordsInserted = new AtomicLong(0);
    private final AtomicLong insertErrors = new AtomicLong(0);
    private final AtomicLong historyQueries = new AtomicLong(0);

    public JdbcMessageStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long persist(RoutedMessage message, RecipientSelector recipient) {
        String recipientUserId = recipient.getType() == RecipientSelector.Type.USERS ? recipient.singleUser() : null;
        String recipientRole = recipient.getRole() != null ? recipient.getRole().name() : null;
        // History is always read within one team.
        String teamId = recipient.getTeamId() != null ? recipient.getTeamId() : message.getTeamId();
        if (teamId == null) {
            throw new PersistenceException("Message " + message.getMessageId() + " has no team");
        }
        // Agent replies are stored as plain chat so history treats them uniformly.
        MessageKind storedKind = message.getKind() == MessageKind.AGENT_RESPONSE ? MessageKind.CHAT : message.getKind();

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(INSERT_MESSAGE, new String[]{"id"});
                ps.setString(1, message.getMessageId());
                ps.setString(2, message.getSenderId());
                ps.setString(3, recipient.getType().name());
                ps.setString(4, recipientUserId);
                ps.setString(5, recipientRole);
                ps.setString(6, teamId);
                ps.setString(7, storedKind.name());
                ps.setString(8, message.getContent());
                ps.setTimestamp(9, Timestamp.from(message.getOriginTimestamp()));
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            insertErrors.incrementAndGet();
            log.error("Failed to persist message {} from {}: {}", message.getMessageId(), message.getSenderId(), e.getMessage());
            throw new PersistenceException("Failed to persist message " + message.getMessageId(), e);
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            insertErrors.incrementAndGet();
            throw new PersistenceException("No record id generated for message " + message.getMessageId());
        }

        recordsInserted.incrementAndGet();
        log.debug("Persisted message {} as record {} ({} -> {})",
                message.getMessageId(), key, message.getSenderId(), recipient.getType());
        return key.longValue();
    }

    @Override
    public List<PersistedRecord> fetchHistory(UserIdentity user, int limit) {
        historyQueries.incrementAndGet();
        try {
            List<PersistedRecord> newestFirst = jdbcTemplate.query(SELECT_HISTORY, RECORD_MAPPER,
                    user.getTeamId(),
                    user.getUserId(),
                    user.getUserId(),
                    user.getRole().name(),
                    limit);

            List<PersistedRecord> records = new ArrayList<>(newestFirst);
            Collections.reverse(records);
            return records;
        } catch (DataAccessException e) {
            log.error("Failed to fetch history for user {}: {}", user.getUserId(), e.getMessage());
            throw new PersistenceException("Failed to fetch history for user " + user.getUserId(), e);
        }
    }

    /**
     * Lightweight connectivity check for health reporting.
     */
    public boolean testConnection() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.error("Database connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private static final RowMapper<PersistedRecord> RECORD_MAPPER = (ResultSet rs, int rowNum) ->
            PersistedRecord.builder()
                    .recordId(rs.getLong("id"))
                    .messageId(rs.getString("message_id"))
                    .senderId(rs.getString("sender_id"))
                    .recipient(mapRecipient(rs))
                    .teamId(rs.getString("recipient_team_id"))
                    .kind(MessageKind.valueOf(rs.getString("kind")))
                    .content(rs.getString("content"))
                    .originTimestamp(rs.getTimestamp("origin_timestamp").toInstant())
                    .build();

    private static RecipientSelector mapRecipient(ResultSet rs) throws SQLException {
        RecipientSelector.Type type = RecipientSelector.Type.valueOf(rs.getString("recipient_type"));
        switch (type) {
            case USERS:
                return RecipientSelector.user(rs.getString("recipient_user_id"));
            case ROLE_IN_TEAM:
                return RecipientSelector.roleInTeam(
                        Role.valueOf(rs.getString("recipient_role")),
                        rs.getString("recipient_team_id"));
            case AGENT:
            default:
                return RecipientSelector.agent();
        }
    }

    public long getRecordsInserted() {
        return recordsInserted.get();
    }

    public long getInsertErrors() {
        return insertErrors.get();
    }

    public long getHistoryQueries() {
        return historyQueries.get();
    }
}
