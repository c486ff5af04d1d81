package com.ivamare.callsession.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionStatus;
import com.ivamare.callsession.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of SessionRepository.
 */
public class JdbcSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionRepository.class);

    static final String COLUMNS = """
        id, started_at, ended_at, caller_id, callee_id, status,
        initial_metadata, disposition, created_at, updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonbCodec jsonb;
    private final RowMapper<CallSession> sessionMapper;

    public JdbcSessionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonb = new JsonbCodec(objectMapper);
        this.sessionMapper = createSessionMapper();
    }

    private RowMapper<CallSession> createSessionMapper() {
        return (rs, rowNum) -> {
            Timestamp endedAt = rs.getTimestamp("ended_at");

            return new CallSession(
                UUID.fromString(rs.getString("id")),
                rs.getTimestamp("started_at").toInstant(),
                endedAt != null ? endedAt.toInstant() : null,
                rs.getString("caller_id"),
                rs.getString("callee_id"),
                SessionStatus.fromValue(rs.getString("status")),
                jsonb.read(rs.getString("initial_metadata")),
                rs.getString("disposition"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        };
    }

    @Override
    public CallSession insert(CallSession session) {
        String sql = """
            INSERT INTO sessions (
                id, started_at, caller_id, callee_id, status,
                initial_metadata, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?::session_status, ?::jsonb, ?, ?)
            RETURNING
            """ + COLUMNS;

        CallSession saved = jdbcTemplate.queryForObject(sql, sessionMapper,
            session.id(),
            Timestamp.from(session.startedAt()),
            session.callerId(),
            session.calleeId(),
            session.status().getValue(),
            jsonb.write(session.initialMetadata()),
            Timestamp.from(session.createdAt()),
            Timestamp.from(session.updatedAt())
        );

        log.debug("Inserted session {}", session.id());
        return saved;
    }

    @Override
    public Optional<CallSession> findById(UUID sessionId) {
        String sql = "SELECT " + COLUMNS + " FROM sessions WHERE id = ?";

        List<CallSession> results = jdbcTemplate.query(sql, sessionMapper, sessionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<CallSession> endIfOngoing(UUID sessionId, SessionStatus status,
                                              String disposition, Instant endedAt) {
        String sql = """
            UPDATE sessions SET
                status = ?::session_status,
                disposition = ?,
                ended_at = ?,
                updated_at = NOW()
            WHERE id = ? AND status = 'ongoing'
            RETURNING
            """ + COLUMNS;

        List<CallSession> results = jdbcTemplate.query(sql, sessionMapper,
            status.getValue(),
            disposition,
            Timestamp.from(endedAt),
            sessionId
        );

        if (results.isEmpty()) {
            log.debug("Conditional end matched no ongoing row for session {}", sessionId);
            return Optional.empty();
        }
        return Optional.of(results.get(0));
    }

    @Override
    public long count(SessionFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM sessions WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendConditions(filter, sql, params);

        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    @Override
    public List<CallSession> find(SessionFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM sessions WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendConditions(filter, sql, params);

        // Column and direction come from enums, never from raw input
        sql.append(" ORDER BY ").append(filter.sortBy().column())
            .append(' ').append(filter.sortOrder().sql())
            .append(", id ").append(filter.sortOrder().sql())
            .append(" LIMIT ? OFFSET ?");
        params.add(filter.limit());
        params.add(filter.offset());

        return jdbcTemplate.query(sql.toString(), sessionMapper, params.toArray());
    }

    private void appendConditions(SessionFilter filter, StringBuilder sql, List<Object> params) {
        if (filter.startDate() != null) {
            sql.append(" AND started_at >= ?");
            params.add(Timestamp.from(filter.startDate()));
        }
        if (filter.endDate() != null) {
            sql.append(" AND started_at <= ?");
            params.add(Timestamp.from(filter.endDate()));
        }
        if (filter.status() != null) {
            sql.append(" AND status = ?::session_status");
            params.add(filter.status().getValue());
        }
        if (filter.callerId() != null) {
            sql.append(" AND caller_id = ?");
            params.add(filter.callerId());
        }
        if (filter.calleeId() != null) {
            sql.append(" AND callee_id = ?");
            params.add(filter.calleeId());
        }
    }
}
