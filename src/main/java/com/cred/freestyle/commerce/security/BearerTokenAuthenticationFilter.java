package com.cred.freestyle.commerce.security;

import com.cred.freestyle.commerce.exception.AuthenticationFailedException;
import com.cred.freestyle.commerce.service.AuthenticationService;
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
import java.util.Collections;
import java.util.List;

/**
 * Authentication filter that resolves {@code Authorization: Bearer <token>}
 * through {@link AuthenticationService}.
 *
 * - Valid token: installs an authentication whose principal is the user or
 *   admin ID, with authority ROLE_USER or ROLE_ADMIN.
 * - Missing or invalid token: the request continues unauthenticated, so public
 *   endpoints still work and protected ones answer 401.
 *
 * @author Commerce Platform Team
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticationService authenticationService;

    public BearerTokenAuthenticationFilter(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String token = extractToken(request);

        if (token != null) {
            try {
                AuthenticatedPrincipal principal = authenticationService.authenticate(token);

                List<SimpleGrantedAuthority> authorities = Collections.singletonList(
                    new SimpleGrantedAuthority(principal.getAuthority())
                );

                UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal.getPrincipalId(), null, authorities);

                SecurityContextHolder.getContext().setAuthentication(authentication);

                logger.debug("Authenticated {} with authority {}", principal.getPrincipalId(), principal.getAuthority());
            } catch (AuthenticationFailedException e) {
                logger.debug("Bearer token rejected for {}: {}", request.getRequestURI(), e.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    private String extractToken(HttpServletRequest request) {
        return extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    }

    /**
     * Pull the token out of an Authorization header value.
     *
     * @return the token, or null when the header is absent or not a bearer credential
     */
    public static String extractToken(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
