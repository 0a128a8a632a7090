package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.AuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository interface for AuthToken entity.
 *
 * @author Commerce Platform Team
 */
@Repository
public interface AuthTokenRepository extends JpaRepository<AuthToken, String> {

    /**
     * Revoke a token by its digest.
     *
     * @param tokenId Token digest
     * @return Number of updated rows (0 or 1)
     */
    @Modifying
    @Query("UPDATE AuthToken t SET t.revoked = true WHERE t.tokenId = :tokenId")
    int revoke(@Param("tokenId") String tokenId);

    /**
     * Revoke every live token of a principal.
     *
     * @param principalId User or admin ID
     * @return Number of revoked tokens
     */
    @Modifying
    @Query("UPDATE AuthToken t SET t.revoked = true WHERE t.principalId = :principalId AND t.revoked = false")
    int revokeAllForPrincipal(@Param("principalId") String principalId);

    /**
     * Delete tokens that expired before the given instant.
     *
     * @param cutoff Expiry cutoff
     * @return Number of deleted tokens
     */
    @Modifying
    @Query("DELETE FROM AuthToken t WHERE t.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
