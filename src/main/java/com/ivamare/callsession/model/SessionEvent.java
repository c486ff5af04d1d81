package com.ivamare.callsession.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable, timestamped fact attached to a call session.
 *
 * @param id Unique identifier
 * @param sessionId Owning session
 * @param eventType Free-text category
 * @param eventTime Caller-supplied time of the event
 * @param metadata Open metadata document (nullable)
 * @param createdAt Server-assigned insertion time
 */
public record SessionEvent(
    UUID id,
    UUID sessionId,
    String eventType,
    Instant eventTime,
    JsonNode metadata,
    Instant createdAt
) {
    public static SessionEvent create(UUID sessionId, String eventType, Instant eventTime,
                                      JsonNode metadata, Instant now) {
        return new SessionEvent(UUID.randomUUID(), sessionId, eventType, eventTime, metadata, now);
    }
}
