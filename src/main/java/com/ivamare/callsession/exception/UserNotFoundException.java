package com.ivamare.callsession.exception;

import java.util.UUID;

/**
 * Thrown when a user cannot be found.
 */
public class UserNotFoundException extends CallSessionException {

    private final UUID userId;

    public UserNotFoundException(UUID userId) {
        super("user not found");
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
