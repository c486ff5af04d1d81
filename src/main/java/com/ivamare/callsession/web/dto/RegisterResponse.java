package com.ivamare.callsession.web.dto;

import com.ivamare.callsession.model.User;

public record RegisterResponse(String message, User user) {
}
