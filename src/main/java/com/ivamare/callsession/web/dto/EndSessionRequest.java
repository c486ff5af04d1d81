package com.ivamare.callsession.web.dto;

import com.ivamare.callsession.model.SessionStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Body of {@code POST /api/sessions/{id}/end}. Only terminal statuses are accepted downstream.
 */
public record EndSessionRequest(
    @NotNull(message = "status is required") SessionStatus status,
    @NotBlank(message = "disposition is required") String disposition,
    @NotNull(message = "end_time is required") Instant endTime
) {
}
