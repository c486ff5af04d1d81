package com.ivamare.callsession.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/sessions/start}. {@code initial_metadata} may be any JSON value.
 */
public record StartSessionRequest(
    @NotBlank(message = "caller_id is required") String callerId,
    @NotBlank(message = "callee_id is required") String calleeId,
    JsonNode initialMetadata
) {
}
