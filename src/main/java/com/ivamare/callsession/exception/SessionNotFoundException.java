package com.ivamare.callsession.exception;

import java.util.UUID;

/**
 * Thrown when a session cannot be found.
 */
public class SessionNotFoundException extends CallSessionException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("session not found");
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
