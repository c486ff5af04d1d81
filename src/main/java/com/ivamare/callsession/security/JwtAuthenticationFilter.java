package com.ivamare.callsession.security;

import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.exception.UnauthorizedException;
import com.ivamare.callsession.model.UserPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Resolves the bearer token of a request into a {@link UserPrincipal}.
 *
 * <p>The filter never rejects a request itself. When authentication fails the
 * reason is stored under {@link #FAILURE_ATTRIBUTE} and the security chain's
 * entry point turns it into a 401 for protected routes.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE";

    static final String MISSING_HEADER = "authorization header is required";
    static final String MALFORMED_HEADER = "invalid authorization header format";

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityService identityService;

    public JwtAuthenticationFilter(IdentityService identityService) {
        this.identityService = identityService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) {
            request.setAttribute(FAILURE_ATTRIBUTE, MISSING_HEADER);
        } else if (!authHeader.startsWith(BEARER_PREFIX)) {
            request.setAttribute(FAILURE_ATTRIBUTE, MALFORMED_HEADER);
        } else {
            authenticate(request, authHeader.substring(BEARER_PREFIX.length()).trim());
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String token) {
        try {
            UserPrincipal principal = identityService.authenticate(token);
            UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
            SecurityContextHolder.getContext().setAuthentication(auth);
        } catch (UnauthorizedException e) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), e.getMessage());
            request.setAttribute(FAILURE_ATTRIBUTE, e.getMessage());
        }
    }
}
