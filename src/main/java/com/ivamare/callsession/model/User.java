package com.ivamare.callsession.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered account. The password hash is never serialized.
 */
public record User(
    UUID id,
    String email,
    @JsonIgnore String passwordHash,
    UserRole role,
    Instant createdAt,
    Instant updatedAt
) {
    public static User register(String email, String passwordHash, Instant now) {
        return new User(UUID.randomUUID(), email, passwordHash, UserRole.USER, now, now);
    }

    public UserPrincipal toPrincipal() {
        return new UserPrincipal(id, email, role);
    }
}
