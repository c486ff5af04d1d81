package com.ivamare.callsession.exception;

/**
 * Thrown when an email/password pair does not match an account. The same
 * message is used for unknown emails and wrong passwords.
 */
public class InvalidCredentialsException extends CallSessionException {

    public InvalidCredentialsException() {
        super("invalid credentials");
    }
}
