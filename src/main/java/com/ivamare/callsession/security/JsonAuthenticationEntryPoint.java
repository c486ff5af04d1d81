package com.ivamare.callsession.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.callsession.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Writes {@code {"error": "..."}} with 401, using the reason recorded by
 * {@link JwtAuthenticationFilter} when there is one.
 */
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String DEFAULT_MESSAGE = "unauthorized";

    private final ObjectMapper objectMapper;

    public JsonAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object reason = request.getAttribute(JwtAuthenticationFilter.FAILURE_ATTRIBUTE);
        String message = reason instanceof String s ? s : DEFAULT_MESSAGE;

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(message));
    }
}
