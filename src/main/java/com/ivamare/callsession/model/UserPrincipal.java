package com.ivamare.callsession.model;

import java.security.Principal;
import java.util.UUID;

/**
 * Authenticated identity derived from a verified bearer token.
 */
public record UserPrincipal(UUID userId, String email, UserRole role) implements Principal {

    @Override
    public String getName() {
        return email;
    }
}
