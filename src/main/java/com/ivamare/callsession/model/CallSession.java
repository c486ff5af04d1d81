package com.ivamare.callsession.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A tracked call between a caller and a callee.
 *
 * <p>{@code endedAt} and {@code disposition} stay null while the session is
 * ongoing and are set together with the terminal status.
 *
 * @param id Unique identifier, assigned at creation
 * @param startedAt When the session started
 * @param endedAt When the session ended (nullable)
 * @param callerId Opaque caller identifier
 * @param calleeId Opaque callee identifier
 * @param status Current status
 * @param initialMetadata Open metadata document supplied at start (nullable)
 * @param disposition Free-text outcome reason recorded at termination (nullable)
 * @param createdAt Row creation timestamp
 * @param updatedAt Last mutation timestamp
 */
public record CallSession(
    UUID id,
    Instant startedAt,
    Instant endedAt,
    String callerId,
    String calleeId,
    SessionStatus status,
    JsonNode initialMetadata,
    String disposition,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Creates a new ongoing session starting at {@code now}.
     */
    public static CallSession start(String callerId, String calleeId, JsonNode initialMetadata, Instant now) {
        return new CallSession(
            UUID.randomUUID(),
            now, null,
            callerId, calleeId,
            SessionStatus.ONGOING,
            initialMetadata,
            null,
            now, now
        );
    }

    public boolean isOngoing() {
        return status == SessionStatus.ONGOING;
    }
}
