package com.ivamare.callsession.web.dto;

/**
 * Error body returned for every failed request.
 */
public record ErrorResponse(String error) {
}
