package com.ivamare.callsession.exception;

/**
 * Thrown when registering an email that already has an account.
 */
public class DuplicateUserException extends ConflictException {

    private final String email;

    public DuplicateUserException(String email) {
        super("user already exists");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
