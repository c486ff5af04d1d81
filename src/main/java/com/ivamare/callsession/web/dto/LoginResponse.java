package com.ivamare.callsession.web.dto;

import com.ivamare.callsession.model.User;

public record LoginResponse(String token, User user) {
}
