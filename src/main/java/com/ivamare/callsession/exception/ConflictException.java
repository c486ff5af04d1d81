package com.ivamare.callsession.exception;

/**
 * Base for requests that conflict with the current state of a resource.
 */
public abstract class ConflictException extends CallSessionException {

    protected ConflictException(String message) {
        super(message);
    }
}
