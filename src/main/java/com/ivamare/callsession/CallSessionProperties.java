package com.ivamare.callsession;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the call session service.
 *
 * <p>Example configuration:
 * <pre>
 * callsession:
 *   enabled: true
 *   jwt:
 *     secret: ${JWT_SECRET}
 *     issuer: call-session-management
 *     ttl: 24h
 *   listing:
 *     max-limit: 500
 *   cors:
 *     allowed-origins: ["*"]
 * </pre>
 */
@ConfigurationProperties(prefix = "callsession")
public class CallSessionProperties {

    /**
     * Enable/disable call session auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Bearer token configuration.
     */
    private JwtProperties jwt = new JwtProperties();

    /**
     * Session listing configuration.
     */
    private ListingProperties listing = new ListingProperties();

    /**
     * Cross-origin configuration for the HTTP API.
     */
    private CorsProperties cors = new CorsProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public JwtProperties getJwt() {
        return jwt;
    }

    public void setJwt(JwtProperties jwt) {
        this.jwt = jwt;
    }

    public ListingProperties getListing() {
        return listing;
    }

    public void setListing(ListingProperties listing) {
        this.listing = listing;
    }

    public CorsProperties getCors() {
        return cors;
    }

    public void setCors(CorsProperties cors) {
        this.cors = cors;
    }

    /**
     * Bearer token signing and lifetime.
     */
    public static class JwtProperties {

        /**
         * HMAC-SHA256 signing secret. Must be set outside tests.
         */
        private String secret;

        /**
         * Issuer claim written to and required on every token.
         */
        private String issuer = "call-session-management";

        /**
         * Token time-to-live.
         */
        private Duration ttl = Duration.ofHours(24);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getIssuer() {
            return issuer;
        }

        public void setIssuer(String issuer) {
            this.issuer = issuer;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    /**
     * Session listing bounds.
     */
    public static class ListingProperties {

        /**
         * Largest page size a listing request may ask for.
         */
        private int maxLimit = 500;

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    /**
     * Allowed cross-origin callers.
     */
    public static class CorsProperties {

        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        private Duration maxAge = Duration.ofHours(12);

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }
}
