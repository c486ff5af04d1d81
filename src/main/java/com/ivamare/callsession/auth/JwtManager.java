package com.ivamare.callsession.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies bearer tokens for authenticated users.
 * <p>
 * Tokens are signed with HMAC-SHA256 and carry the user ID, email and role
 * alongside the registered issuer, subject, issued-at, not-before and expiry
 * claims.
 */
public class JwtManager {

    private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final Algorithm algorithm;
    private final JWTVerifier verifier;
    private final String issuer;
    private final Duration ttl;
    private final Clock clock;

    /**
     * Creates a new JwtManager on the system UTC clock.
     *
     * @param secret HMAC-SHA256 signing secret
     * @param issuer JWT issuer claim
     * @param ttl    token time-to-live
     */
    public JwtManager(byte[] secret, String issuer, Duration ttl) {
        this(secret, issuer, ttl, Clock.systemUTC());
    }

    /**
     * Creates a new JwtManager.
     *
     * @param secret HMAC-SHA256 signing secret
     * @param issuer JWT issuer claim
     * @param ttl    token time-to-live
     * @param clock  source of issue times and of the verification instant
     */
    public JwtManager(byte[] secret, String issuer, Duration ttl, Clock clock) {
        this.algorithm = Algorithm.HMAC256(secret);
        this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer)).build(clock);
        this.issuer = issuer;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Claims of a successfully verified token.
     *
     * @param userId the user ID
     * @param email  the email at issue time
     * @param role   the role at issue time
     */
    public record TokenClaims(UUID userId, String email, UserRole role) {
    }

    /**
     * Issues a token for a user.
     *
     * @param user the authenticated user
     * @return signed JWT string
     */
    public String issueToken(User user) {
        Instant now = clock.instant();

        String token = JWT.create()
            .withIssuer(issuer)
            .withSubject(user.id().toString())
            .withClaim(CLAIM_USER_ID, user.id().toString())
            .withClaim(CLAIM_EMAIL, user.email())
            .withClaim(CLAIM_ROLE, user.role().getValue())
            .withIssuedAt(now)
            .withNotBefore(now)
            .withExpiresAt(now.plus(ttl))
            .sign(algorithm);

        log.debug("Issued token for user {}", user.id());
        return token;
    }

    /**
     * Verifies signature, issuer, expiry and not-before of a token.
     *
     * @param token JWT string
     * @return claims if valid, empty otherwise
     */
    public Optional<TokenClaims> verify(String token) {
        try {
            DecodedJWT decoded = verifier.verify(token);
            String userId = decoded.getClaim(CLAIM_USER_ID).asString();
            String role = decoded.getClaim(CLAIM_ROLE).asString();
            if (userId == null || role == null) {
                log.debug("JWT missing required claims");
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                UUID.fromString(userId),
                decoded.getClaim(CLAIM_EMAIL).asString(),
                UserRole.fromValue(role)));
        } catch (JWTVerificationException e) {
            log.debug("JWT verification failed: {}", e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.debug("JWT carries malformed claims: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
