package com.ivamare.callsession.exception;

import java.util.UUID;

/**
 * Thrown when logging an event against a session that is no longer ongoing.
 */
public class SessionEndedException extends ConflictException {

    private final UUID sessionId;

    public SessionEndedException(UUID sessionId) {
        super("cannot log events for ended session");
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
