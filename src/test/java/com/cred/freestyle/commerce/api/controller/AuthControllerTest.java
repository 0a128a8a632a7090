package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.commerce.domain.model.AuthToken.PrincipalType;
import com.cred.freestyle.commerce.exception.AuthenticationFailedException;
import com.cred.freestyle.commerce.service.AuthenticationService;
import com.cred.freestyle.commerce.service.IssuedToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuthController.class)
@ContextConfiguration(classes = {AuthController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("AuthController Tests")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthenticationService authenticationService;

    @Test
    @DisplayName("POST /auth/login - valid credentials return a bearer token")
    void login_Success() throws Exception {
        // Given
        when(authenticationService.login("ann@example.com", "secret-pass"))
                .thenReturn(new IssuedToken("tok-1", "user-1", PrincipalType.USER, Instant.now().plusSeconds(3600)));

        // When / Then
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"ann@example.com\", \"password\": \"secret-pass\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("tok-1"))
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.principalId").value("user-1"))
                .andExpect(jsonPath("$.principalType").value("USER"));
    }

    @Test
    @DisplayName("POST /auth/login - bad credentials return 401")
    void login_BadCredentials() throws Exception {
        when(authenticationService.login(anyString(), anyString()))
                .thenThrow(new AuthenticationFailedException("Invalid credentials"));

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"ann@example.com\", \"password\": \"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    @DisplayName("POST /auth/login - malformed email returns 400")
    void login_InvalidEmail() throws Exception {
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"not-an-email\", \"password\": \"x\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(authenticationService);
    }

    @Test
    @DisplayName("POST /auth/logout - revokes the bearer token and returns 204")
    void logout() throws Exception {
        mockMvc.perform(post("/api/v1/auth/logout").header("Authorization", "Bearer tok-1"))
                .andExpect(status().isNoContent());

        verify(authenticationService).logout("tok-1");
    }
}
