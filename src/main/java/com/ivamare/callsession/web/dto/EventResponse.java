package com.ivamare.callsession.web.dto;

import com.ivamare.callsession.model.SessionEvent;

public record EventResponse(String message, SessionEvent event) {
}
