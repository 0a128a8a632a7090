package com.cred.freestyle.commerce.security;

import com.cred.freestyle.commerce.domain.model.AuthToken;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for issued bearer tokens, keyed by the digest of the secret.
 *
 * @author Commerce Platform Team
 */
public interface CredentialStore {

    void save(AuthToken token);

    /**
     * Find a token that is neither revoked nor expired at {@code now}.
     *
     * @param tokenId Token digest
     * @param now Evaluation time
     * @return Usable token, if any
     */
    Optional<AuthToken> findUsable(String tokenId, Instant now);

    /**
     * @return true if a token was revoked
     */
    boolean revoke(String tokenId);

    /**
     * Revoke all tokens issued to a principal.
     *
     * @return Number of revoked tokens
     */
    int revokeAllFor(String principalId);

    /**
     * Remove tokens that expired before {@code now}.
     *
     * @return Number of removed tokens
     */
    int purgeExpired(Instant now);
}
