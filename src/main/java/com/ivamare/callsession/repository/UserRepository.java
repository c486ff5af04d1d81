package com.ivamare.callsession.repository;

import com.ivamare.callsession.model.User;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for user accounts.
 */
public interface UserRepository {

    /**
     * Insert a new user.
     *
     * @param user The user to insert
     * @return The persisted row as stored
     * @throws org.springframework.dao.DuplicateKeyException if the email is taken
     */
    User insert(User user);

    /**
     * Check whether an account exists for an email.
     *
     * @param email The email
     * @return true if registered
     */
    boolean existsByEmail(String email);

    /**
     * Get a user by email, including the password hash.
     *
     * @param email The email
     * @return Optional containing the user if found
     */
    Optional<User> findByEmail(String email);

    /**
     * Get a user by ID.
     *
     * @param userId The user ID
     * @return Optional containing the user if found
     */
    Optional<User> findById(UUID userId);
}
