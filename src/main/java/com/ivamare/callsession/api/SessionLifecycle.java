package com.ivamare.callsession.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionDetails;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionPage;
import com.ivamare.callsession.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Owns the session state machine: start, terminate, read and list.
 *
 * <p>A session moves from {@code ongoing} to exactly one terminal status.
 * Termination is a compare-and-swap on the stored status, so concurrent end
 * requests for the same session produce exactly one success even across
 * server processes.
 */
public interface SessionLifecycle {

    /**
     * Start a new ongoing session.
     *
     * <p>No check is made for other sessions between the same pair.
     *
     * @param callerId Caller identifier (required)
     * @param calleeId Callee identifier (required)
     * @param initialMetadata Open metadata document (nullable)
     * @return The persisted session
     * @throws com.ivamare.callsession.exception.ValidationException if an identifier is blank
     */
    CallSession startSession(String callerId, String calleeId, JsonNode initialMetadata);

    /**
     * End an ongoing session.
     *
     * @param sessionId The session ID
     * @param status Terminal status, completed or failed
     * @param disposition Outcome reason
     * @param endTime End time, not before the session start
     * @return The terminated session
     * @throws com.ivamare.callsession.exception.SessionNotFoundException if no such session
     * @throws com.ivamare.callsession.exception.SessionAlreadyEndedException if already terminal
     * @throws com.ivamare.callsession.exception.SessionEndRaceLostException if a concurrent end won
     * @throws com.ivamare.callsession.exception.ValidationException for bad status or end time
     */
    CallSession endSession(UUID sessionId, SessionStatus status, String disposition, Instant endTime);

    /**
     * Get a session and its events ordered by event time ascending.
     *
     * @param sessionId The session ID
     * @return Session details
     * @throws com.ivamare.callsession.exception.SessionNotFoundException if no such session
     */
    SessionDetails getSessionDetails(UUID sessionId);

    /**
     * List sessions matching a filter.
     *
     * @param filter Filter, sort and page window
     * @return The page plus the total matching count
     * @throws com.ivamare.callsession.exception.ValidationException for an invalid page window or date range
     */
    SessionPage listSessions(SessionFilter filter);
}
