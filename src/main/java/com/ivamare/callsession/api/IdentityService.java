package com.ivamare.callsession.api;

import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserPrincipal;
import com.ivamare.callsession.model.UserRole;

import java.util.UUID;

/**
 * Registration, credential login, bearer token verification and role checks.
 */
public interface IdentityService {

    /**
     * Result of a successful credential login.
     *
     * @param token Signed bearer token
     * @param user The authenticated user
     */
    record LoginResult(String token, User user) {}

    /**
     * Register a new account with role {@code user}.
     *
     * @throws com.ivamare.callsession.exception.DuplicateUserException if the email is taken
     * @throws com.ivamare.callsession.exception.ValidationException for a malformed email or short password
     */
    User register(String email, String password);

    /**
     * Check an email/password pair and issue a bearer token.
     *
     * @throws com.ivamare.callsession.exception.InvalidCredentialsException on any mismatch
     */
    LoginResult authenticateCredentials(String email, String password);

    /**
     * Verify a bearer token and resolve its principal.
     *
     * @throws com.ivamare.callsession.exception.UnauthorizedException if the token is invalid or the user is gone
     */
    UserPrincipal authenticate(String token);

    /**
     * Require a role of a principal. Admins satisfy every role.
     *
     * @throws com.ivamare.callsession.exception.InsufficientRoleException if the role does not suffice
     */
    void authorize(UserPrincipal principal, UserRole requiredRole);

    /**
     * Get a user by ID.
     *
     * @throws com.ivamare.callsession.exception.UserNotFoundException if no such user
     */
    User getUser(UUID userId);
}
