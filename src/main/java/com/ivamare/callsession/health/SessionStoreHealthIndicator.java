package com.ivamare.callsession.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the session store.
 *
 * <p>Checks:
 * <ul>
 *   <li>A pooled connection is valid</li>
 *   <li>The users, sessions and session_events tables exist</li>
 *   <li>Reports the number of ongoing sessions</li>
 * </ul>
 */
public class SessionStoreHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;
    private static final int EXPECTED_TABLES = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;

    public SessionStoreHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Integer tables = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM information_schema.tables
                WHERE table_schema = current_schema()
                  AND table_name IN ('users', 'sessions', 'session_events')
                """,
                Integer.class
            );

            if (tables == null || tables < EXPECTED_TABLES) {
                return Health.down()
                    .withDetail("error", "session schema incomplete")
                    .withDetail("tables", tables != null ? tables : 0)
                    .build();
            }

            Long ongoing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sessions WHERE status = 'ongoing'",
                Long.class
            );

            Health.Builder builder = Health.up()
                .withDetail("schema", "ready")
                .withDetail("ongoingSessions", ongoing != null ? ongoing : 0L);

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
