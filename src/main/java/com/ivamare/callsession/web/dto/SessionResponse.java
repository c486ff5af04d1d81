package com.ivamare.callsession.web.dto;

import com.ivamare.callsession.model.CallSession;

public record SessionResponse(String message, CallSession session) {
}
