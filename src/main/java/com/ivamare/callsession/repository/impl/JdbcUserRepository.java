package com.ivamare.callsession.repository.impl;

import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserRole;
import com.ivamare.callsession.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of UserRepository.
 */
public class JdbcUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserRepository.class);

    private static final RowMapper<User> USER_MAPPER = (rs, rowNum) -> new User(
        UUID.fromString(rs.getString("id")),
        rs.getString("email"),
        rs.getString("password"),
        UserRole.fromValue(rs.getString("role")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public User insert(User user) {
        User saved = jdbcTemplate.queryForObject("""
            INSERT INTO users (id, email, password, role, created_at, updated_at)
            VALUES (?, ?, ?, ?::user_role, ?, ?)
            RETURNING id, email, password, role, created_at, updated_at
            """,
            USER_MAPPER,
            user.id(),
            user.email(),
            user.passwordHash(),
            user.role().getValue(),
            Timestamp.from(user.createdAt()),
            Timestamp.from(user.updatedAt())
        );

        log.debug("Inserted user {}", user.id());
        return saved;
    }

    @Override
    public boolean existsByEmail(String email) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM users WHERE email = ?)",
            Boolean.class,
            email
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        List<User> results = jdbcTemplate.query(
            "SELECT id, email, password, role, created_at, updated_at FROM users WHERE email = ?",
            USER_MAPPER,
            email
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<User> findById(UUID userId) {
        List<User> results = jdbcTemplate.query(
            "SELECT id, email, password, role, created_at, updated_at FROM users WHERE id = ?",
            USER_MAPPER,
            userId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
