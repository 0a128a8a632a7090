package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.service.IssuedToken;

import java.time.Instant;

/**
 * Bearer token returned by the login endpoints. The token is shown once;
 * the server keeps only its digest.
 *
 * @author Commerce Platform Team
 */
public class TokenResponse {

    private String token;
    private String tokenType;
    private Instant expiresAt;
    private String principalId;
    private String principalType;

    public TokenResponse() {
    }

    public static TokenResponse from(IssuedToken issued) {
        TokenResponse response = new TokenResponse();
        response.setToken(issued.getToken());
        response.setTokenType("Bearer");
        response.setExpiresAt(issued.getExpiresAt());
        response.setPrincipalId(issued.getPrincipalId());
        response.setPrincipalType(issued.getPrincipalType().name());
        return response;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getTokenType() {
        return tokenType;
    }

    public void setTokenType(String tokenType) {
        this.tokenType = tokenType;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    public String getPrincipalType() {
        return principalType;
    }

    public void setPrincipalType(String principalType) {
        this.principalType = principalType;
    }
}
