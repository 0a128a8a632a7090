package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.AuthToken.PrincipalType;

import java.time.Instant;

/**
 * Bearer token handed to a client after login. The secret is only ever
 * available here; the store keeps its digest.
 *
 * @author Commerce Platform Team
 */
public class IssuedToken {

    private final String token;
    private final String principalId;
    private final PrincipalType principalType;
    private final Instant expiresAt;

    public IssuedToken(String token, String principalId, PrincipalType principalType, Instant expiresAt) {
        this.token = token;
        this.principalId = principalId;
        this.principalType = principalType;
        this.expiresAt = expiresAt;
    }

    public String getToken() {
        return token;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public PrincipalType getPrincipalType() {
        return principalType;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
