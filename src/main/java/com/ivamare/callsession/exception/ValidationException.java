package com.ivamare.callsession.exception;

/**
 * Thrown for malformed or out-of-range input, including temporal bound and
 * ordering violations.
 */
public class ValidationException extends CallSessionException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
