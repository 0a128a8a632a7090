package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Admin;
import com.cred.freestyle.commerce.domain.model.AuthToken;
import com.cred.freestyle.commerce.domain.model.AuthToken.PrincipalType;
import com.cred.freestyle.commerce.domain.model.User;
import com.cred.freestyle.commerce.exception.AuthenticationFailedException;
import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.commerce.repository.AdminRepository;
import com.cred.freestyle.commerce.repository.UserRepository;
import com.cred.freestyle.commerce.security.AuthenticatedPrincipal;
import com.cred.freestyle.commerce.security.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Service for credential verification and bearer token lifecycle.
 *
 * Token format:
 * - 32 random bytes, URL-safe base64 without padding
 * - Stored as the hex SHA-256 digest of that string
 * - Expires after {@code commerce.auth.token-ttl}
 *
 * The rest of the application only ever sees the resolved principal ID.
 *
 * @author Commerce Platform Team
 */
@Service
public class AuthenticationService {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationService.class);

    private static final int TOKEN_BYTES = 32;
    private static final String INVALID_CREDENTIALS = "Invalid credentials";
    private static final String INVALID_TOKEN = "Invalid or expired token";

    private final CredentialStore credentialStore;
    private final UserRepository userRepository;
    private final AdminRepository adminRepository;
    private final PasswordEncoder passwordEncoder;
    private final CommerceMetricsService metricsService;
    private final Duration tokenTtl;
    private final SecureRandom secureRandom = new SecureRandom();

    public AuthenticationService(
            CredentialStore credentialStore,
            UserRepository userRepository,
            AdminRepository adminRepository,
            PasswordEncoder passwordEncoder,
            CommerceMetricsService metricsService,
            @Value("${commerce.auth.token-ttl:PT24H}") String tokenTtl
    ) {
        this.credentialStore = credentialStore;
        this.userRepository = userRepository;
        this.adminRepository = adminRepository;
        this.passwordEncoder = passwordEncoder;
        this.metricsService = metricsService;
        this.tokenTtl = Duration.parse(tokenTtl);
    }

    /**
     * Resolve a bearer token to its principal.
     *
     * @param token Bearer secret as sent by the client
     * @return Authenticated principal
     * @throws AuthenticationFailedException if the token is unknown, revoked or expired,
     *         or its principal no longer exists or is deactivated
     */
    public AuthenticatedPrincipal authenticate(String token) {
        if (token == null || token.isBlank()) {
            metricsService.recordAuthFailure("MISSING_TOKEN");
            throw new AuthenticationFailedException(INVALID_TOKEN);
        }

        AuthToken stored = credentialStore.findUsable(digest(token), Instant.now())
                .orElseThrow(() -> {
                    metricsService.recordAuthFailure("INVALID_TOKEN");
                    return new AuthenticationFailedException(INVALID_TOKEN);
                });

        if (!isActivePrincipal(stored.getPrincipalId(), stored.getPrincipalType())) {
            logger.warn("Token presented for inactive {} {}", stored.getPrincipalType(), stored.getPrincipalId());
            metricsService.recordAuthFailure("INACTIVE_PRINCIPAL");
            throw new AuthenticationFailedException(INVALID_TOKEN);
        }

        return new AuthenticatedPrincipal(stored.getPrincipalId(), stored.getPrincipalType());
    }

    private boolean isActivePrincipal(String principalId, PrincipalType principalType) {
        if (principalType == PrincipalType.ADMIN) {
            return adminRepository.findById(principalId)
                    .map(admin -> Boolean.TRUE.equals(admin.getIsActive()))
                    .orElse(false);
        }
        return userRepository.findById(principalId)
                .map(user -> Boolean.TRUE.equals(user.getIsActive()))
                .orElse(false);
    }

    /**
     * Issue a customer token.
     *
     * @param userId User ID
     * @return Newly issued token
     */
    public IssuedToken issueToken(String userId) {
        return issueToken(userId, PrincipalType.USER);
    }

    /**
     * Issue a token for any principal type.
     *
     * @param principalId User or admin ID
     * @param principalType Principal type
     * @return Newly issued token
     */
    public IssuedToken issueToken(String principalId, PrincipalType principalType) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        String secret = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        Instant now = Instant.now();
        Instant expiresAt = now.plus(tokenTtl);

        credentialStore.save(AuthToken.builder()
                .tokenId(digest(secret))
                .principalId(principalId)
                .principalType(principalType)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .revoked(false)
                .build());

        logger.info("Issued {} token for {}, expires at {}", principalType, principalId, expiresAt);
        return new IssuedToken(secret, principalId, principalType, expiresAt);
    }

    /**
     * Customer login with email and password.
     *
     * @param email Email address (case-insensitive)
     * @param password Plain password
     * @return Newly issued token
     * @throws AuthenticationFailedException on unknown email, wrong password or inactive account
     */
    public IssuedToken login(String email, String password) {
        String normalizedEmail = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);

        User user = userRepository.findByEmail(normalizedEmail)
                .filter(u -> Boolean.TRUE.equals(u.getIsActive()))
                .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> {
                    logger.warn("Failed login for email {}", normalizedEmail);
                    metricsService.recordAuthFailure("BAD_CREDENTIALS");
                    return new AuthenticationFailedException(INVALID_CREDENTIALS);
                });

        return issueToken(user.getUserId(), PrincipalType.USER);
    }

    /**
     * Back-office login with username and password.
     *
     * @param username Admin username
     * @param password Plain password
     * @return Newly issued admin token
     */
    public IssuedToken adminLogin(String username, String password) {
        Admin admin = adminRepository.findByUsername(username)
                .filter(a -> Boolean.TRUE.equals(a.getIsActive()))
                .filter(a -> passwordEncoder.matches(password, a.getPasswordHash()))
                .orElseThrow(() -> {
                    logger.warn("Failed admin login for username {}", username);
                    metricsService.recordAuthFailure("BAD_ADMIN_CREDENTIALS");
                    return new AuthenticationFailedException(INVALID_CREDENTIALS);
                });

        return issueToken(admin.getAdminId(), PrincipalType.ADMIN);
    }

    /**
     * Revoke a token (logout). Unknown tokens are ignored.
     *
     * @param token Bearer secret
     */
    public void logout(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        boolean revoked = credentialStore.revoke(digest(token));
        logger.info("Logout processed, token revoked: {}", revoked);
    }

    /**
     * Revoke every token of a principal, e.g. when the account is deactivated.
     *
     * @param principalId User or admin ID
     * @return Number of revoked tokens
     */
    public int revokeAllTokens(String principalId) {
        int revoked = credentialStore.revokeAllFor(principalId);
        logger.info("Revoked {} tokens for {}", revoked, principalId);
        return revoked;
    }

    /**
     * Delete expired tokens.
     *
     * @return Number of deleted tokens
     */
    public int purgeExpiredTokens() {
        return credentialStore.purgeExpired(Instant.now());
    }

    static String digest(String token) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
