package com.example.pipeline.shared.repository;

import com.example.pipeline.shared.aspect.Monitored;
import com.example.pipeline.shared.dto.EventQuery;
import com.example.pipeline.shared.model.Event;
import com.example.pipeline.shared.model.EventTypeCount;
import com.example.pipeline.shared.util.JsonUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only event log plus the per-type counter table.
 */
@Repository
@Monitored("repository")
public class EventRepository {

    private final JdbcTemplate jdbcTemplate;

    public EventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<Event> eventRowMapper = new RowMapper<>() {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Event.builder()
                    .id(rs.getString("id"))
                    .eventType(rs.getString("event_type"))
                    .source(rs.getString("source"))
                    .sessionId(rs.getString("session_id"))
                    .userId(rs.getString("user_id"))
                    .payload(JsonUtils.parsePayload(rs.getString("payload")))
                    .timestamp(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                    .build();
        }
    };

    private final RowMapper<EventTypeCount> countRowMapper = (rs, rowNum) -> EventTypeCount.builder()
            .eventType(rs.getString("event_type"))
            .count(rs.getLong("event_count"))
            .lastSeen(toInstant(rs.getObject("last_seen", OffsetDateTime.class)))
            .build();

    @Transactional
    public Event insert(Event event) {
        OffsetDateTime createdAt = toOffsetDateTime(event.getTimestamp());
        jdbcTemplate.update("""
                INSERT INTO events (id, event_type, source, session_id, user_id, payload, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                event.getId(),
                event.getEventType(),
                event.getSource(),
                event.getSessionId(),
                event.getUserId(),
                JsonUtils.toPayloadJson(event.getPayload()),
                createdAt);

        jdbcTemplate.update("""
                MERGE INTO event_stats AS t
                USING (
                    SELECT
                        CAST(? AS VARCHAR(50)) AS event_type,
                        CAST(? AS TIMESTAMP WITH TIME ZONE) AS last_seen
                ) AS s ON t.event_type = s.event_type
                WHEN MATCHED THEN
                    UPDATE SET event_count = t.event_count + 1, last_seen = s.last_seen
                WHEN NOT MATCHED THEN
                    INSERT (event_type, event_count, last_seen) VALUES (s.event_type, 1, s.last_seen)
                """,
                event.getEventType(),
                createdAt);
        return event;
    }

    public Optional<Event> findById(String id) {
        List<Event> results = jdbcTemplate.query("SELECT * FROM events WHERE id = ?", eventRowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Newest first. {@code since} is an exclusive lower bound on the creation time.
     */
    public List<Event> query(EventQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM events WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (query.getEventType() != null && !query.getEventType().isEmpty()) {
            sql.append(" AND event_type = ?");
            params.add(query.getEventType());
        }
        if (query.getSessionId() != null && !query.getSessionId().isEmpty()) {
            sql.append(" AND session_id = ?");
            params.add(query.getSessionId());
        }
        if (query.getUserId() != null && !query.getUserId().isEmpty()) {
            sql.append(" AND user_id = ?");
            params.add(query.getUserId());
        }
        if (query.getSince() != null) {
            sql.append(" AND created_at > ?");
            params.add(toOffsetDateTime(query.getSince()));
        }

        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ?");
        params.add(query.getLimit());

        return jdbcTemplate.query(sql.toString(), eventRowMapper, params.toArray());
    }

    public long countAll() {
        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Long.class);
        return total != null ? total : 0L;
    }

    public long countSince(Instant since) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM events WHERE created_at > ?", Long.class, toOffsetDateTime(since));
        return count != null ? count : 0L;
    }

    public List<EventTypeCount> countByType() {
        return jdbcTemplate.query(
                "SELECT event_type, event_count, last_seen FROM event_stats ORDER BY event_count DESC, event_type",
                countRowMapper);
    }

    /**
     * Deletes events strictly older than {@code before}; with no bound the log and the counters are cleared.
     *
     * @return number of events removed
     */
    @Transactional
    public int deleteEvents(Instant before) {
        if (before != null) {
            return jdbcTemplate.update("DELETE FROM events WHERE created_at < ?", toOffsetDateTime(before));
        }
        int deleted = jdbcTemplate.update("DELETE FROM events");
        jdbcTemplate.update("DELETE FROM event_stats");
        return deleted;
    }

    public boolean ping() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
