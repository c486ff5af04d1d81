package com.ivamare.callsession.repository;

import com.ivamare.callsession.model.SessionEvent;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for session events. Events are append-only.
 */
public interface SessionEventRepository {

    /**
     * Append an event if, and only if, its session is still ongoing.
     *
     * <p>The status check and the insert are a single statement that locks the
     * session row, so an event can never be appended after a termination
     * has committed.
     *
     * @param event The event to append
     * @return Optional containing the stored event, empty if the session is
     *         missing or no longer ongoing
     */
    Optional<SessionEvent> insertIfSessionOngoing(SessionEvent event);

    /**
     * List events of a session ordered by event time ascending.
     *
     * @param sessionId The session ID
     * @return Events in replay order
     */
    List<SessionEvent> findBySessionId(UUID sessionId);
}
