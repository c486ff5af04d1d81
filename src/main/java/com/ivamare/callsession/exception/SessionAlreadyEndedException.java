package com.ivamare.callsession.exception;

import com.ivamare.callsession.model.SessionStatus;

import java.util.UUID;

/**
 * Thrown when ending a session that has already reached a terminal status.
 */
public class SessionAlreadyEndedException extends ConflictException {

    private final UUID sessionId;
    private final SessionStatus status;

    public SessionAlreadyEndedException(UUID sessionId, SessionStatus status) {
        super("session is already ended with status: " + status.getValue());
        this.sessionId = sessionId;
        this.status = status;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
