package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.AdminLoginRequest;
import com.cred.freestyle.commerce.api.dto.LoginRequest;
import com.cred.freestyle.commerce.api.dto.TokenResponse;
import com.cred.freestyle.commerce.security.BearerTokenAuthenticationFilter;
import com.cred.freestyle.commerce.service.AuthenticationService;
import com.cred.freestyle.commerce.service.IssuedToken;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Login and logout for customers and admins.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthenticationService authenticationService;

    public AuthController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        IssuedToken issued = authenticationService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(TokenResponse.from(issued));
    }

    @PostMapping("/admin/login")
    public ResponseEntity<TokenResponse> adminLogin(@Valid @RequestBody AdminLoginRequest request) {
        IssuedToken issued = authenticationService.adminLogin(request.getUsername(), request.getPassword());
        return ResponseEntity.ok(TokenResponse.from(issued));
    }

    /**
     * Revoke the bearer token sent with this request. Always 204, even for unknown tokens.
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String token = BearerTokenAuthenticationFilter.extractToken(authorization);
        if (token != null) {
            authenticationService.logout(token);
        } else {
            logger.debug("Logout without bearer token");
        }
        return ResponseEntity.noContent().build();
    }
}
