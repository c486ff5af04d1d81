package com.ivamare.callsession.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.callsession.model.SessionEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Appends immutable events to ongoing sessions.
 */
public interface EventLogger {

    /**
     * Log an event against a session.
     *
     * <p>Checks, in order: the session exists, it is still ongoing, and the
     * event time is within the admission window ending at the server clock.
     *
     * @param sessionId The session ID
     * @param eventType Free-text category (required)
     * @param eventTime When the event happened (required)
     * @param metadata Open metadata document (nullable)
     * @return The stored event
     * @throws com.ivamare.callsession.exception.SessionNotFoundException if no such session
     * @throws com.ivamare.callsession.exception.SessionEndedException if the session has ended
     * @throws com.ivamare.callsession.exception.ValidationException for bad input or an event time that is too old
     */
    SessionEvent logEvent(UUID sessionId, String eventType, Instant eventTime, JsonNode metadata);
}
