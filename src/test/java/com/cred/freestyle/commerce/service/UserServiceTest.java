package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.User;
import com.cred.freestyle.commerce.exception.DuplicateResourceException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;
import java.util.Optional;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aUser;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService Unit Tests")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private AuditService auditService;

    @Mock
    private AuthenticationService authenticationService;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, passwordEncoder, auditService, authenticationService);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("register - email is normalized and the password stored as a bcrypt hash")
    void register_HashesPassword() {
        // Given
        when(userRepository.existsByEmail("ana@example.com")).thenReturn(false);
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        User user = userService.register("Ana", " Ana@Example.com ", "s3cret-pass", null, "1 Main St");

        // Then
        assertThat(user.getEmail()).isEqualTo("ana@example.com");
        assertThat(user.getPasswordHash()).isNotEqualTo("s3cret-pass");
        assertThat(passwordEncoder.matches("s3cret-pass", user.getPasswordHash())).isTrue();
        assertThat(user.getIsActive()).isTrue();
    }

    @Test
    @DisplayName("register - duplicate email is rejected")
    void register_DuplicateEmail() {
        when(userRepository.existsByEmail("ana@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register("Ana", "ana@example.com", "pw-123456", null, null))
                .isInstanceOf(DuplicateResourceException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("getUser - deactivated users are not found")
    void getUser_Inactive() {
        User user = aUser().isActive(false).build();
        when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> userService.getUser(user.getUserId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("updateUser - changing to an email owned by someone else is rejected")
    void updateUser_EmailTaken() {
        User user = aUser().email("old@example.com").build();
        when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));
        when(userRepository.existsByEmail("taken@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.updateUser(user.getUserId(), null, "taken@example.com", null, null))
                .isInstanceOf(DuplicateResourceException.class);
    }

    @Test
    @DisplayName("updateUser - null fields are left unchanged")
    void updateUser_PartialUpdate() {
        // Given
        User user = aUser().name("Ana").phone("555").address("Old St").build();
        when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        User updated = userService.updateUser(user.getUserId(), null, null, null, "New St");

        // Then
        assertThat(updated.getName()).isEqualTo("Ana");
        assertThat(updated.getPhone()).isEqualTo("555");
        assertThat(updated.getAddress()).isEqualTo("New St");
    }

    @Test
    @DisplayName("deactivateUser - self deletion revokes tokens and is not audited")
    void deactivateUser_BySelf() {
        User user = aUser().build();
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                user.getUserId(), null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
        when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));

        userService.deactivateUser(user.getUserId());

        assertThat(user.getIsActive()).isFalse();
        verify(userRepository).save(user);
        verify(authenticationService).revokeAllTokens(user.getUserId());
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("deactivateUser - admin deletion is audited")
    void deactivateUser_ByAdmin() {
        User user = aUser().build();
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                "admin-1", null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))));
        when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));
        when(auditService.snapshot(user)).thenReturn("{}");

        userService.deactivateUser(user.getUserId());

        verify(auditService).record(eq("admin-1"), eq(AuditAction.DELETE), eq("users"),
                eq(user.getUserId()), eq("{}"), eq(user));
    }
}
