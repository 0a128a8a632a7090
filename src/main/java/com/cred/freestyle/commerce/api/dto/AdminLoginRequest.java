package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Back-office login.
 *
 * @author Commerce Platform Team
 */
public class AdminLoginRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;

    public AdminLoginRequest() {
    }

    public AdminLoginRequest(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
