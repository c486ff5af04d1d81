package com.ivamare.callsession.api.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.callsession.api.EventLogger;
import com.ivamare.callsession.exception.ConstraintViolationClassifier;
import com.ivamare.callsession.exception.SessionEndedException;
import com.ivamare.callsession.exception.SessionNotFoundException;
import com.ivamare.callsession.exception.ValidationException;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionEvent;
import com.ivamare.callsession.repository.SessionEventRepository;
import com.ivamare.callsession.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Default implementation of EventLogger.
 */
public class DefaultEventLogger implements EventLogger {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventLogger.class);

    static final String EVENT_TOO_OLD_MESSAGE = "event_time must be within the last year";

    /** Same interval as the valid_event_time check constraint in schema.sql. */
    static final Period MAX_EVENT_AGE = Period.ofYears(1);

    private final SessionRepository sessionRepository;
    private final SessionEventRepository eventRepository;
    private final Clock clock;

    public DefaultEventLogger(
            SessionRepository sessionRepository,
            SessionEventRepository eventRepository,
            Clock clock) {
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    @Override
    public SessionEvent logEvent(UUID sessionId, String eventType, Instant eventTime, JsonNode metadata) {
        if (eventType == null || eventType.isBlank()) {
            throw new ValidationException("event_type is required");
        }
        if (eventTime == null) {
            throw new ValidationException("event_time is required");
        }

        CallSession session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!session.isOngoing()) {
            log.warn("Rejected {} event for session {}: session is {}",
                eventType, sessionId, session.status().getValue());
            throw new SessionEndedException(sessionId);
        }

        Instant now = clock.instant();
        if (eventTime.isBefore(oldestAdmissible(now))) {
            throw new ValidationException(EVENT_TOO_OLD_MESSAGE);
        }

        SessionEvent event = SessionEvent.create(sessionId, eventType, eventTime, metadata, now);
        SessionEvent saved;
        try {
            saved = eventRepository.insertIfSessionOngoing(event)
                .orElseThrow(() -> rejectionAfterRace(sessionId));
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolationClassifier.isCheckViolation(e, ConstraintViolationClassifier.VALID_EVENT_TIME)) {
                throw new ValidationException(EVENT_TOO_OLD_MESSAGE, e);
            }
            throw e;
        }

        log.info("Logged {} event {} for session {}", eventType, saved.id(), sessionId);
        return saved;
    }

    /**
     * Oldest accepted event time, inclusive. Calendar arithmetic in UTC to
     * match the storage interval check.
     */
    Instant oldestAdmissible(Instant now) {
        return now.atOffset(ZoneOffset.UTC).minus(MAX_EVENT_AGE).toInstant();
    }

    private RuntimeException rejectionAfterRace(UUID sessionId) {
        // Status changed between the read and the conditional insert
        if (sessionRepository.findById(sessionId).isEmpty()) {
            return new SessionNotFoundException(sessionId);
        }
        log.warn("Session {} ended while an event was being logged", sessionId);
        return new SessionEndedException(sessionId);
    }
}
