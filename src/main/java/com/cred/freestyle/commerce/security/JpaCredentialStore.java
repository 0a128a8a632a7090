package com.cred.freestyle.commerce.security;

import com.cred.freestyle.commerce.domain.model.AuthToken;
import com.cred.freestyle.commerce.repository.AuthTokenRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * {@link CredentialStore} backed by the auth_tokens table.
 *
 * @author Commerce Platform Team
 */
@Component
public class JpaCredentialStore implements CredentialStore {

    private final AuthTokenRepository authTokenRepository;

    public JpaCredentialStore(AuthTokenRepository authTokenRepository) {
        this.authTokenRepository = authTokenRepository;
    }

    @Override
    @Transactional
    public void save(AuthToken token) {
        authTokenRepository.save(token);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthToken> findUsable(String tokenId, Instant now) {
        return authTokenRepository.findById(tokenId)
                .filter(token -> token.isUsableAt(now));
    }

    @Override
    @Transactional
    public boolean revoke(String tokenId) {
        return authTokenRepository.revoke(tokenId) > 0;
    }

    @Override
    @Transactional
    public int revokeAllFor(String principalId) {
        return authTokenRepository.revokeAllForPrincipal(principalId);
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return authTokenRepository.deleteExpiredBefore(now);
    }
}
