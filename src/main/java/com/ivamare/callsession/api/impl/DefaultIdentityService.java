package com.ivamare.callsession.api.impl;

import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.auth.JwtManager;
import com.ivamare.callsession.exception.ConstraintViolationClassifier;
import com.ivamare.callsession.exception.DuplicateUserException;
import com.ivamare.callsession.exception.InsufficientRoleException;
import com.ivamare.callsession.exception.InvalidCredentialsException;
import com.ivamare.callsession.exception.UnauthorizedException;
import com.ivamare.callsession.exception.UserNotFoundException;
import com.ivamare.callsession.exception.ValidationException;
import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserPrincipal;
import com.ivamare.callsession.model.UserRole;
import com.ivamare.callsession.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Default implementation of IdentityService backed by the users table,
 * BCrypt password hashes and HMAC-signed JWTs.
 */
public class DefaultIdentityService implements IdentityService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIdentityService.class);

    static final int MIN_PASSWORD_LENGTH = 6;
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtManager jwtManager;
    private final Clock clock;

    public DefaultIdentityService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtManager jwtManager,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtManager = jwtManager;
        this.clock = clock;
    }

    @Override
    public User register(String email, String password) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new ValidationException("a valid email is required");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateUserException(email);
        }

        User user = User.register(email, passwordEncoder.encode(password), clock.instant());
        User saved;
        try {
            saved = userRepository.insert(user);
        } catch (DataIntegrityViolationException e) {
            // Lost a registration race on the unique email index
            if (ConstraintViolationClassifier.isUniqueViolation(e)) {
                throw new DuplicateUserException(email);
            }
            throw e;
        }

        log.info("Registered user {}", saved.id());
        return saved;
    }

    @Override
    public LoginResult authenticateCredentials(String email, String password) {
        if (email == null || password == null) {
            throw new InvalidCredentialsException();
        }
        User user = userRepository.findByEmail(email)
            .orElseThrow(InvalidCredentialsException::new);
        if (!passwordEncoder.matches(password, user.passwordHash())) {
            log.debug("Password mismatch for user {}", user.id());
            throw new InvalidCredentialsException();
        }

        String token = jwtManager.issueToken(user);
        log.info("User {} logged in", user.id());
        return new LoginResult(token, user);
    }

    @Override
    public UserPrincipal authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("invalid token");
        }
        JwtManager.TokenClaims claims = jwtManager.verify(token)
            .orElseThrow(() -> new UnauthorizedException("invalid token"));

        return userRepository.findById(claims.userId())
            .map(User::toPrincipal)
            .orElseThrow(() -> new UnauthorizedException("user not found"));
    }

    @Override
    public void authorize(UserPrincipal principal, UserRole requiredRole) {
        if (principal == null || !principal.role().satisfies(requiredRole)) {
            throw new InsufficientRoleException(requiredRole);
        }
    }

    @Override
    public User getUser(UUID userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
