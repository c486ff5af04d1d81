package com.ivamare.callsession.exception;

import com.ivamare.callsession.model.UserRole;

/**
 * Thrown when an authenticated principal lacks the role an operation requires.
 */
public class InsufficientRoleException extends CallSessionException {

    private final UserRole requiredRole;

    public InsufficientRoleException(UserRole requiredRole) {
        super("insufficient permissions: required role " + requiredRole.getValue());
        this.requiredRole = requiredRole;
    }

    public UserRole getRequiredRole() {
        return requiredRole;
    }
}
