package com.ivamare.callsession.api.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.callsession.CallSessionProperties;
import com.ivamare.callsession.api.SessionLifecycle;
import com.ivamare.callsession.exception.ConstraintViolationClassifier;
import com.ivamare.callsession.exception.SessionAlreadyEndedException;
import com.ivamare.callsession.exception.SessionEndRaceLostException;
import com.ivamare.callsession.exception.SessionNotFoundException;
import com.ivamare.callsession.exception.ValidationException;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionDetails;
import com.ivamare.callsession.model.SessionEvent;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionPage;
import com.ivamare.callsession.model.SessionStatus;
import com.ivamare.callsession.repository.SessionEventRepository;
import com.ivamare.callsession.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation of SessionLifecycle.
 */
public class DefaultSessionLifecycle implements SessionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DefaultSessionLifecycle.class);

    static final String END_BEFORE_START_MESSAGE = "end_time must be after or equal to started_at";

    private final SessionRepository sessionRepository;
    private final SessionEventRepository eventRepository;
    private final CallSessionProperties properties;
    private final Clock clock;

    /**
     * Creates a new DefaultSessionLifecycle.
     *
     * @param sessionRepository The session repository
     * @param eventRepository The event repository
     * @param properties Service configuration
     * @param clock Source of the current time
     */
    public DefaultSessionLifecycle(
            SessionRepository sessionRepository,
            SessionEventRepository eventRepository,
            CallSessionProperties properties,
            Clock clock) {
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CallSession startSession(String callerId, String calleeId, JsonNode initialMetadata) {
        requireText(callerId, "caller_id is required");
        requireText(calleeId, "callee_id is required");

        CallSession session = CallSession.start(callerId, calleeId, initialMetadata, clock.instant());
        CallSession saved = sessionRepository.insert(session);

        log.info("Started session {} (caller={}, callee={})", saved.id(), callerId, calleeId);
        return saved;
    }

    @Override
    public CallSession endSession(UUID sessionId, SessionStatus status, String disposition, Instant endTime) {
        if (status == null || !status.isTerminal()) {
            throw new ValidationException("status must be one of: completed, failed");
        }
        requireText(disposition, "disposition is required");
        if (endTime == null) {
            throw new ValidationException("end_time is required");
        }

        CallSession current = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));

        if (!current.isOngoing()) {
            log.warn("Rejected end of session {}: already {}", sessionId, current.status().getValue());
            throw new SessionAlreadyEndedException(sessionId, current.status());
        }
        if (endTime.isBefore(current.startedAt())) {
            throw new ValidationException(END_BEFORE_START_MESSAGE);
        }

        CallSession ended;
        try {
            ended = sessionRepository.endIfOngoing(sessionId, status, disposition, endTime)
                .orElseThrow(() -> {
                    log.warn("Session {} was ended by a concurrent request", sessionId);
                    return new SessionEndRaceLostException(sessionId);
                });
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolationClassifier.isCheckViolation(e, ConstraintViolationClassifier.VALID_SESSION_TIMES)) {
                throw new ValidationException(END_BEFORE_START_MESSAGE, e);
            }
            throw e;
        }

        log.info("Ended session {} with status {} (disposition={})",
            sessionId, status.getValue(), disposition);
        return ended;
    }

    @Override
    public SessionDetails getSessionDetails(UUID sessionId) {
        CallSession session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));

        List<SessionEvent> events = eventRepository.findBySessionId(sessionId);
        return new SessionDetails(session, events);
    }

    @Override
    public SessionPage listSessions(SessionFilter filter) {
        int maxLimit = properties.getListing().getMaxLimit();
        if (filter.limit() < 1 || filter.limit() > maxLimit) {
            throw new ValidationException("limit must be between 1 and " + maxLimit);
        }
        if (filter.offset() < 0) {
            throw new ValidationException("offset must not be negative");
        }
        if (filter.startDate() != null && filter.endDate() != null
                && filter.startDate().isAfter(filter.endDate())) {
            throw new ValidationException("start_date must not be after end_date");
        }

        long total = sessionRepository.count(filter);
        List<CallSession> sessions = sessionRepository.find(filter);

        log.debug("Listed {} of {} sessions (limit={}, offset={})",
            sessions.size(), total, filter.limit(), filter.offset());
        return new SessionPage(total, filter.limit(), filter.offset(), sessions);
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }
}
