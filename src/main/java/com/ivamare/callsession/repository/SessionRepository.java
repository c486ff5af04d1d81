package com.ivamare.callsession.repository;

import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for call sessions.
 */
public interface SessionRepository {

    /**
     * Insert a new session.
     *
     * @param session The session to insert
     * @return The persisted row as stored
     */
    CallSession insert(CallSession session);

    /**
     * Get a session by ID.
     *
     * @param sessionId The session ID
     * @return Optional containing the session if found
     */
    Optional<CallSession> findById(UUID sessionId);

    /**
     * Atomically move an ongoing session to a terminal status.
     *
     * <p>The update only applies while the stored status is still
     * {@code ongoing}, so among concurrent callers at most one succeeds.
     *
     * @param sessionId The session ID
     * @param status Terminal status to set
     * @param disposition Outcome reason
     * @param endedAt End time
     * @return Optional containing the updated session, empty if the session
     *         was not ongoing when the update ran
     */
    Optional<CallSession> endIfOngoing(UUID sessionId, SessionStatus status, String disposition, Instant endedAt);

    /**
     * Count sessions matching the filter, ignoring its page window.
     *
     * @param filter The filter
     * @return Number of matching sessions
     */
    long count(SessionFilter filter);

    /**
     * Query one page of sessions matching the filter.
     *
     * @param filter The filter, including sort and page window
     * @return Matching sessions in the requested order
     */
    List<CallSession> find(SessionFilter filter);
}
