package com.ivamare.callsession.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role carried by a principal. Two tiers: {@link #ADMIN} satisfies every
 * required role, any other role must match exactly.
 */
public enum UserRole {
    USER("user"),
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Check whether this role grants access to something requiring {@code required}.
     *
     * @param required the role the operation requires
     * @return true if access is granted
     */
    public boolean satisfies(UserRole required) {
        return this == ADMIN || this == required;
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        for (UserRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown UserRole: " + value);
    }
}
