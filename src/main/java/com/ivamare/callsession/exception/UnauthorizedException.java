package com.ivamare.callsession.exception;

/**
 * Thrown when a bearer credential is missing, malformed, expired or refers
 * to an unknown user.
 */
public class UnauthorizedException extends CallSessionException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
