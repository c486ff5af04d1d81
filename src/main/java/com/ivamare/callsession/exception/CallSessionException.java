package com.ivamare.callsession.exception;

/**
 * Base exception for all call session errors.
 */
public class CallSessionException extends RuntimeException {

    public CallSessionException(String message) {
        super(message);
    }

    public CallSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
