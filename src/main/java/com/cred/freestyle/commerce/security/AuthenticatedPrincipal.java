package com.cred.freestyle.commerce.security;

import com.cred.freestyle.commerce.domain.model.AuthToken.PrincipalType;

/**
 * Identity resolved from a bearer token.
 *
 * @author Commerce Platform Team
 */
public class AuthenticatedPrincipal {

    private final String principalId;
    private final PrincipalType principalType;

    public AuthenticatedPrincipal(String principalId, PrincipalType principalType) {
        this.principalId = principalId;
        this.principalType = principalType;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public PrincipalType getPrincipalType() {
        return principalType;
    }

    /**
     * @return Spring Security authority for this principal (ROLE_USER or ROLE_ADMIN)
     */
    public String getAuthority() {
        return "ROLE_" + principalType.name();
    }
}
