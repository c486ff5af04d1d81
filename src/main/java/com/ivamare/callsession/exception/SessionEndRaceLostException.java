package com.ivamare.callsession.exception;

import java.util.UUID;

/**
 * Thrown when the session was ongoing at read time but another request
 * terminated it before the conditional update ran.
 */
public class SessionEndRaceLostException extends ConflictException {

    private final UUID sessionId;

    public SessionEndRaceLostException(UUID sessionId) {
        super("session could not be ended - it may have been ended by another request");
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
