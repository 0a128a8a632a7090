package com.cred.freestyle.commerce.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SecurityUtils Tests")
class SecurityUtilsTest {

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private void authenticate(String principalId, String role) {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principalId, null, List.of(new SimpleGrantedAuthority(role))));
    }

    @Test
    @DisplayName("verifyUserAccess - owner is allowed")
    void owner() {
        authenticate("user-1", "ROLE_USER");

        assertThatCode(() -> SecurityUtils.verifyUserAccess("user-1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("verifyUserAccess - another user is denied")
    void otherUser() {
        authenticate("user-1", "ROLE_USER");

        assertThatThrownBy(() -> SecurityUtils.verifyUserAccess("user-2"))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("verifyUserAccess - admin may access any user")
    void admin() {
        authenticate("admin-1", "ROLE_ADMIN");

        assertThat(SecurityUtils.isAdmin()).isTrue();
        assertThatCode(() -> SecurityUtils.verifyUserAccess("user-2")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("requireCurrentUserId - anonymous request is denied")
    void anonymous() {
        assertThat(SecurityUtils.getCurrentUserId()).isNull();
        assertThatThrownBy(SecurityUtils::requireCurrentUserId).isInstanceOf(AccessDeniedException.class);
    }
}
