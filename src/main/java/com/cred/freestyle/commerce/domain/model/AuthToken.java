package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Issued bearer token. Only the SHA-256 digest of the secret is stored,
 * so a leaked table cannot be replayed.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "auth_tokens", indexes = {
    @Index(name = "idx_auth_tokens_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthToken {

    /**
     * Hex-encoded SHA-256 digest of the bearer secret.
     */
    @Id
    @Column(name = "token_id", nullable = false, length = 64)
    private String tokenId;

    @Column(name = "principal_id", nullable = false, length = 36)
    private String principalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "principal_type", nullable = false, length = 10)
    private PrincipalType principalType;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "revoked", nullable = false)
    @Builder.Default
    private Boolean revoked = false;

    public boolean isUsableAt(Instant now) {
        return !Boolean.TRUE.equals(revoked) && expiresAt.isAfter(now);
    }

    public enum PrincipalType {
        USER,
        ADMIN
    }
}
