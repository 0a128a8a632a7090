package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.api.dto.RegisterUserRequest;
import com.cred.freestyle.commerce.api.dto.UpdateUserRequest;
import com.cred.freestyle.commerce.api.dto.UserResponse;
import com.cred.freestyle.commerce.domain.model.User;
import com.cred.freestyle.commerce.security.SecurityUtils;
import com.cred.freestyle.commerce.service.UserService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for customer accounts.
 *
 * Authorization: registration is public; a user may read, update or
 * delete only their own record unless ADMIN.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        User user = userService.register(
                request.getName(),
                request.getEmail(),
                request.getPassword(),
                request.getPhone(),
                request.getAddress()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromEntity(user));
    }

    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getCurrentUser() {
        return ResponseEntity.ok(UserResponse.fromEntity(userService.getUser(SecurityUtils.requireCurrentUserId())));
    }

    @GetMapping("/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getUser(@PathVariable String userId) {
        SecurityUtils.verifyUserAccess(userId);
        return ResponseEntity.ok(UserResponse.fromEntity(userService.getUser(userId)));
    }

    @PutMapping("/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable String userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        SecurityUtils.verifyUserAccess(userId);
        User user = userService.updateUser(
                userId,
                request.getName(),
                request.getEmail(),
                request.getPhone(),
                request.getAddress()
        );
        return ResponseEntity.ok(UserResponse.fromEntity(user));
    }

    @DeleteMapping("/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteUser(@PathVariable String userId) {
        SecurityUtils.verifyUserAccess(userId);
        logger.info("Deactivating user {}", userId);
        userService.deactivateUser(userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PageResponse<UserResponse>> listUsers(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                userService.listUsers(Pagination.of(page, size)), UserResponse::fromEntity));
    }
}
