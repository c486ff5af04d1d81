package com.ivamare.callsession.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.callsession.api.EventLogger;
import com.ivamare.callsession.api.SessionLifecycle;
import com.ivamare.callsession.exception.SessionAlreadyEndedException;
import com.ivamare.callsession.exception.SessionEndRaceLostException;
import com.ivamare.callsession.exception.SessionEndedException;
import com.ivamare.callsession.exception.SessionNotFoundException;
import com.ivamare.callsession.exception.ValidationException;
import com.ivamare.callsession.model.CallSession;
import com.ivamare.callsession.model.SessionDetails;
import com.ivamare.callsession.model.SessionEvent;
import com.ivamare.callsession.model.SessionFilter;
import com.ivamare.callsession.model.SessionPage;
import com.ivamare.callsession.model.SessionStatus;
import com.ivamare.callsession.model.SortField;
import com.ivamare.callsession.model.SortOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionController")
class SessionControllerTest {

    private static final Instant STARTED = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private SessionLifecycle sessionLifecycle;

    @Mock
    private EventLogger eventLogger;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.mockMvc(new SessionController(sessionLifecycle, eventLogger));
    }

    private CallSession ongoing(UUID id) {
        return new CallSession(id, STARTED, null, "alice", "bob", SessionStatus.ONGOING,
            MockMvcSupport.OBJECT_MAPPER.createObjectNode().put("codec", "opus"), null, STARTED, STARTED);
    }

    @Nested
    @DisplayName("POST /api/sessions/start")
    class Start {

        @Test
        @DisplayName("should return 201 with snake_case session body")
        void shouldStartSession() throws Exception {
            UUID id = UUID.randomUUID();
            when(sessionLifecycle.startSession(eq("alice"), eq("bob"), any(JsonNode.class)))
                .thenReturn(ongoing(id));

            mockMvc.perform(post("/api/sessions/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"caller_id": "alice", "callee_id": "bob", "initial_metadata": {"codec": "opus"}}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Session started successfully"))
                .andExpect(jsonPath("$.session.id").value(id.toString()))
                .andExpect(jsonPath("$.session.caller_id").value("alice"))
                .andExpect(jsonPath("$.session.status").value("ongoing"))
                .andExpect(jsonPath("$.session.started_at").value("2024-06-01T12:00:00Z"))
                .andExpect(jsonPath("$.session.initial_metadata.codec").value("opus"));
        }

        @Test
        @DisplayName("should return 400 when caller is missing")
        void shouldRejectMissingCaller() throws Exception {
            mockMvc.perform(post("/api/sessions/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"callee_id\": \"bob\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("caller_id is required"));

            verifyNoInteractions(sessionLifecycle);
        }

        @Test
        @DisplayName("should return 400 on malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/api/sessions/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"caller_id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid request body"));
        }
    }

    @Nested
    @DisplayName("POST /api/sessions/{id}/events")
    class LogEvent {

        @Test
        @DisplayName("should return 201 with the event")
        void shouldLogEvent() throws Exception {
            UUID sessionId = UUID.randomUUID();
            Instant eventTime = Instant.parse("2024-06-01T12:00:05Z");
            SessionEvent event = SessionEvent.create(sessionId, "ring", eventTime, null, STARTED);
            when(eventLogger.logEvent(eq(sessionId), eq("ring"), eq(eventTime), isNull())).thenReturn(event);

            mockMvc.perform(post("/api/sessions/{id}/events", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\": \"ring\", \"event_time\": \"2024-06-01T12:00:05Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Event logged successfully"))
                .andExpect(jsonPath("$.event.session_id").value(sessionId.toString()))
                .andExpect(jsonPath("$.event.event_type").value("ring"));
        }

        @Test
        @DisplayName("should map ended session to 409")
        void shouldMapEndedSession() throws Exception {
            UUID sessionId = UUID.randomUUID();
            when(eventLogger.logEvent(any(), any(), any(), any())).thenThrow(new SessionEndedException(sessionId));

            mockMvc.perform(post("/api/sessions/{id}/events", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\": \"ring\", \"event_time\": \"2024-06-01T12:00:05Z\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("cannot log events for ended session"));
        }

        @Test
        @DisplayName("should map too-old event to 400")
        void shouldMapTooOldEvent() throws Exception {
            when(eventLogger.logEvent(any(), any(), any(), any()))
                .thenThrow(new ValidationException("event_time must be within the last year"));

            mockMvc.perform(post("/api/sessions/{id}/events", UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\": \"ring\", \"event_time\": \"2020-01-01T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("event_time must be within the last year"));
        }

        @Test
        @DisplayName("should return 400 for a malformed session id")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(post("/api/sessions/not-a-uuid/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\": \"ring\", \"event_time\": \"2024-06-01T12:00:05Z\"}"))
                .andExpect(status().isBadRequest());

            verifyNoInteractions(eventLogger);
        }
    }

    @Nested
    @DisplayName("POST /api/sessions/{id}/end")
    class End {

        private static final String BODY = """
            {"status": "completed", "disposition": "hangup", "end_time": "2024-06-01T12:05:00Z"}
            """;

        @Test
        @DisplayName("should return 200 with ended session")
        void shouldEndSession() throws Exception {
            UUID id = UUID.randomUUID();
            Instant end = Instant.parse("2024-06-01T12:05:00Z");
            CallSession ended = new CallSession(id, STARTED, end, "alice", "bob", SessionStatus.COMPLETED,
                null, "hangup", STARTED, end);
            when(sessionLifecycle.endSession(id, SessionStatus.COMPLETED, "hangup", end)).thenReturn(ended);

            mockMvc.perform(post("/api/sessions/{id}/end", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Session ended successfully"))
                .andExpect(jsonPath("$.session.status").value("completed"))
                .andExpect(jsonPath("$.session.disposition").value("hangup"))
                .andExpect(jsonPath("$.session.ended_at").value("2024-06-01T12:05:00Z"));
        }

        @Test
        @DisplayName("should map already-ended and lost race to 409")
        void shouldMapConflicts() throws Exception {
            UUID id = UUID.randomUUID();
            when(sessionLifecycle.endSession(any(), any(), any(), any()))
                .thenThrow(new SessionAlreadyEndedException(id, SessionStatus.FAILED))
                .thenThrow(new SessionEndRaceLostException(id));

            mockMvc.perform(post("/api/sessions/{id}/end", id).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("session is already ended with status: failed"));
            mockMvc.perform(post("/api/sessions/{id}/end", id).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error")
                    .value("session could not be ended - it may have been ended by another request"));
        }

        @Test
        @DisplayName("should map missing session to 404")
        void shouldMapNotFound() throws Exception {
            UUID id = UUID.randomUUID();
            when(sessionLifecycle.endSession(any(), any(), any(), any())).thenThrow(new SessionNotFoundException(id));

            mockMvc.perform(post("/api/sessions/{id}/end", id).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("session not found"));
        }

        @Test
        @DisplayName("should reject an unknown status value")
        void shouldRejectUnknownStatus() throws Exception {
            mockMvc.perform(post("/api/sessions/{id}/end", UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"status\": \"paused\", \"disposition\": \"x\", \"end_time\": \"2024-06-01T12:05:00Z\"}"))
                .andExpect(status().isBadRequest());

            verifyNoInteractions(sessionLifecycle);
        }
    }

    @Nested
    @DisplayName("GET /api/sessions")
    class ListSessions {

        @Test
        @DisplayName("should bind snake_case query parameters")
        void shouldBindQueryParameters() throws Exception {
            when(sessionLifecycle.listSessions(any())).thenReturn(new SessionPage(12, 5, 10, List.of()));

            mockMvc.perform(get("/api/sessions")
                    .param("start_date", "2024-01-01T00:00:00Z")
                    .param("end_date", "2024-12-31T23:59:59+02:00")
                    .param("status", "completed")
                    .param("caller_id", "alice")
                    .param("limit", "5")
                    .param("offset", "10")
                    .param("sort_by", "caller_id")
                    .param("sort_order", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(12))
                .andExpect(jsonPath("$.limit").value(5))
                .andExpect(jsonPath("$.offset").value(10))
                .andExpect(jsonPath("$.sessions").isEmpty());

            ArgumentCaptor<SessionFilter> captor = ArgumentCaptor.forClass(SessionFilter.class);
            verify(sessionLifecycle).listSessions(captor.capture());
            SessionFilter filter = captor.getValue();
            assertThat(filter.startDate()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
            assertThat(filter.endDate()).isEqualTo(Instant.parse("2024-12-31T21:59:59Z"));
            assertThat(filter.status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(filter.callerId()).isEqualTo("alice");
            assertThat(filter.calleeId()).isNull();
            assertThat(filter.limit()).isEqualTo(5);
            assertThat(filter.offset()).isEqualTo(10);
            assertThat(filter.sortBy()).isEqualTo(SortField.CALLER_ID);
            assertThat(filter.sortOrder()).isEqualTo(SortOrder.ASC);
        }

        @Test
        @DisplayName("should reject invalid status and sort column with 400")
        void shouldRejectInvalidValues() throws Exception {
            mockMvc.perform(get("/api/sessions").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid status value: paused"));
            mockMvc.perform(get("/api/sessions").param("sort_by", "password"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid sort_by value: password"));

            verifyNoInteractions(sessionLifecycle);
        }

        @Test
        @DisplayName("should reject unparseable dates and limits with 400")
        void shouldRejectUnparseableValues() throws Exception {
            mockMvc.perform(get("/api/sessions").param("start_date", "yesterday"))
                .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/sessions").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid limit value: many"));

            verifyNoInteractions(sessionLifecycle);
        }
    }

    @Test
    @DisplayName("GET /api/sessions/{id} should return session and events")
    void shouldReturnDetails() throws Exception {
        UUID id = UUID.randomUUID();
        SessionEvent ring = SessionEvent.create(id, "ring", STARTED.plusSeconds(1), null, STARTED);
        when(sessionLifecycle.getSessionDetails(id)).thenReturn(new SessionDetails(ongoing(id), List.of(ring)));

        mockMvc.perform(get("/api/sessions/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.session.id").value(id.toString()))
            .andExpect(jsonPath("$.events[0].event_type").value("ring"));
    }

    @Test
    @DisplayName("unexpected failures should become 500 with a generic message")
    void shouldHideInternalFailures() throws Exception {
        when(sessionLifecycle.getSessionDetails(any())).thenThrow(new IllegalStateException("pool exhausted"));

        mockMvc.perform(get("/api/sessions/{id}", UUID.randomUUID()))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("internal server error"));
    }

    @Nested
    @DisplayName("unsupported requests")
    class UnsupportedRequests {

        @Test
        @DisplayName("should return 415 for a non-JSON body")
        void shouldRejectUnsupportedContentType() throws Exception {
            mockMvc.perform(post("/api/sessions/start")
                    .contentType(MediaType.TEXT_PLAIN)
                    .content("caller_id=alice"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error").value(containsString("text/plain")));

            verifyNoInteractions(sessionLifecycle);
        }

        @Test
        @DisplayName("should return 405 with Allow header for an unmapped method")
        void shouldRejectUnsupportedMethod() throws Exception {
            mockMvc.perform(delete("/api/sessions"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Allow", containsString("GET")))
                .andExpect(jsonPath("$.error").value(containsString("DELETE")));

            verifyNoInteractions(sessionLifecycle, eventLogger);
        }
    }
}
