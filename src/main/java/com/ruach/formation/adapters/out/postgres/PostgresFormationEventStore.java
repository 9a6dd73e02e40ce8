package com.ruach.formation.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ruach.formation.adapters.codec.FormationEventCodec;
import com.ruach.formation.application.port.out.FormationEventStore;
import com.ruach.formation.domain.entity.FormationEvent;
import com.ruach.formation.domain.valueobject.EventType;

/**
 * PostgreSQL implementation of the FormationEventStore outbound port.
 * <p>
 * Uses JDBC with ON CONFLICT DO NOTHING for idempotent appends. Payload and
 * metadata live in JSONB columns; rows are never updated or deleted.
 * </p>
 */
public class PostgresFormationEventStore implements FormationEventStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresFormationEventStore.class);

    // Idempotent append: duplicate id silently ignored
    private static final String INSERT_EVENT_SQL = "INSERT INTO formation_events "
            + "(id, user_id, timestamp, event_type, payload, metadata) "
            + "VALUES (?::uuid, ?, ?, ?, ?::jsonb, ?::jsonb) "
            + "ON CONFLICT (id) DO NOTHING";

    private static final String SELECT_BY_USER_SQL = "SELECT id, user_id, timestamp, event_type, payload, metadata "
            + "FROM formation_events WHERE user_id = ? "
            + "ORDER BY timestamp ASC, id ASC";

    private final JdbcTemplate jdbcTemplate;
    private final FormationEventCodec codec;

    public PostgresFormationEventStore(JdbcTemplate jdbcTemplate, FormationEventCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void append(List<FormationEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        int[][] counts = jdbcTemplate.batchUpdate(INSERT_EVENT_SQL, events, events.size(), (ps, event) -> {
            ps.setString(1, event.getId());
            ps.setString(2, event.getUserId());
            ps.setTimestamp(3, Timestamp.from(event.getTimestamp()));
            ps.setString(4, event.getEventType().getWireName());
            ps.setString(5, codec.writePayload(event.getPayload()));
            ps.setString(6, event.getMetadata().isEmpty() ? null : codec.writeMetadata(event.getMetadata()));
        });

        int inserted = 0;
        for (int[] batch : counts) {
            for (int rows : batch) {
                inserted += Math.max(rows, 0);
            }
        }
        log.debug("action=events_appended count={} inserted={} skipped={}",
                events.size(), inserted, events.size() - inserted);
    }

    @Override
    public List<FormationEvent> findByUserId(String userId) {
        return jdbcTemplate.query(SELECT_BY_USER_SQL, (rs, rowNum) -> mapRowToEvent(rs), userId);
    }

    // ─────────────────── Private Helpers ───────────────────

    private FormationEvent mapRowToEvent(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        EventType type = EventType.fromWireName(rs.getString("event_type"));
        try {
            return new FormationEvent(
                    id,
                    rs.getString("user_id"),
                    rs.getTimestamp("timestamp").toInstant(),
                    codec.readPayload(type, rs.getString("payload")),
                    codec.readMetadata(rs.getString("metadata")));
        } catch (JsonProcessingException e) {
            log.error("action=event_deserialize_error eventId={} error={}", id, e.getMessage());
            throw new IllegalStateException("Failed to deserialize formation event " + id, e);
        }
    }
}
