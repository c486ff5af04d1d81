package com.ivamare.callsession.web;

import com.ivamare.callsession.api.EventLogger;
import com.ivamare.callsession.api.SessionLifecycle;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionDetails;
import com.ivamare.callsession.model.SessionEvent;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionPage;
import com.ivamare.callsession.web.dto.EndSessionRequest;
import com.ivamare.callsession.web.dto.EventResponse;
import com.ivamare.callsession.web.dto.LogEventRequest;
import com.ivamare.callsession.web.dto.SessionResponse;
import com.ivamare.callsession.web.dto.StartSessionRequest;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Session lifecycle, event logging and listing endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionLifecycle sessionLifecycle;
    private final EventLogger eventLogger;

    public SessionController(SessionLifecycle sessionLifecycle, EventLogger eventLogger) {
        this.sessionLifecycle = sessionLifecycle;
        this.eventLogger = eventLogger;
    }

    @GetMapping
    public SessionPage list(
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "caller_id", required = false) String callerId,
            @RequestParam(name = "callee_id", required = false) String calleeId,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_order", required = false) String sortOrder) {
        SessionFilter filter = SessionFilter.builder()
            .startDate(startDate != null ? startDate.toInstant() : null)
            .endDate(endDate != null ? endDate.toInstant() : null)
            .status(status)
            .callerId(callerId)
            .calleeId(calleeId)
            .limit(limit)
            .offset(offset)
            .sortBy(sortBy)
            .sortOrder(sortOrder)
            .build();
        return sessionLifecycle.listSessions(filter);
    }

    @PostMapping("/start")
    public ResponseEntity<SessionResponse> start(@Valid @RequestBody StartSessionRequest request) {
        CallSession session = sessionLifecycle.startSession(
            request.callerId(), request.calleeId(), request.initialMetadata());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new SessionResponse("Session started successfully", session));
    }

    @PostMapping("/{sessionId}/events")
    public ResponseEntity<EventResponse> logEvent(
            @PathVariable UUID sessionId,
            @Valid @RequestBody LogEventRequest request) {
        SessionEvent event = eventLogger.logEvent(
            sessionId, request.eventType(), request.eventTime(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new EventResponse("Event logged successfully", event));
    }

    @PostMapping("/{sessionId}/end")
    public SessionResponse end(
            @PathVariable UUID sessionId,
            @Valid @RequestBody EndSessionRequest request) {
        CallSession session = sessionLifecycle.endSession(
            sessionId, request.status(), request.disposition(), request.endTime());
        return new SessionResponse("Session ended successfully", session);
    }

    @GetMapping("/{sessionId}")
    public SessionDetails details(@PathVariable UUID sessionId) {
        return sessionLifecycle.getSessionDetails(sessionId);
    }
}
