package com.ivamare.callsession.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record LogEventRequest(
    @NotBlank(message = "event_type is required") String eventType,
    @NotNull(message = "event_time is required") Instant eventTime,
    JsonNode metadata
) {
}
