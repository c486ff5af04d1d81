package com.ivamare.callsession.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.callsession.model.SessionEvent;
import com.ivamare.callsession.repository.SessionEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of SessionEventRepository.
 */
public class JdbcSessionEventRepository implements SessionEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionEventRepository.class);

    private static final String COLUMNS = "id, session_id, event_type, event_time, metadata, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonbCodec jsonb;
    private final RowMapper<SessionEvent> eventMapper;

    public JdbcSessionEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonb = new JsonbCodec(objectMapper);
        this.eventMapper = (rs, rowNum) -> new SessionEvent(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("session_id")),
            rs.getString("event_type"),
            rs.getTimestamp("event_time").toInstant(),
            jsonb.read(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    @Override
    public Optional<SessionEvent> insertIfSessionOngoing(SessionEvent event) {
        // FOR SHARE blocks a concurrent end until this insert commits, and
        // re-checks the status against the latest row version if the end won.
        String sql = """
            INSERT INTO session_events (
                id, session_id, event_type, event_time, metadata, created_at
            )
            SELECT ?::uuid, s.id, ?, ?::timestamptz, ?::jsonb, ?::timestamptz
            FROM sessions s
            WHERE s.id = ?::uuid AND s.status = 'ongoing'
            FOR SHARE
            RETURNING
            """ + COLUMNS;

        List<SessionEvent> results = jdbcTemplate.query(sql, eventMapper,
            event.id(),
            event.eventType(),
            Timestamp.from(event.eventTime()),
            jsonb.write(event.metadata()),
            Timestamp.from(event.createdAt()),
            event.sessionId()
        );

        if (results.isEmpty()) {
            log.debug("Event {} not appended, session {} missing or not ongoing", event.id(), event.sessionId());
            return Optional.empty();
        }

        log.debug("Appended event {} ({}) to session {}", event.id(), event.eventType(), event.sessionId());
        return Optional.of(results.get(0));
    }

    @Override
    public List<SessionEvent> findBySessionId(UUID sessionId) {
        String sql = "SELECT " + COLUMNS + """
             FROM session_events
            WHERE session_id = ?
            ORDER BY event_time ASC, created_at ASC
            """;

        return jdbcTemplate.query(sql, eventMapper, sessionId);
    }
}
