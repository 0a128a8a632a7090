package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.User;
import com.cred.freestyle.commerce.exception.DuplicateResourceException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.UserRepository;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Service for customer accounts.
 *
 * @author Commerce Platform Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;
    private final AuthenticationService authenticationService;

    public UserService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            AuditService auditService,
            AuthenticationService authenticationService
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
        this.authenticationService = authenticationService;
    }

    /**
     * Register a new customer.
     *
     * @throws DuplicateResourceException if the email is already registered
     */
    @Transactional
    public User register(String name, String email, String password, String phone, String address) {
        String normalizedEmail = normalizeEmail(email);
        if (userRepository.existsByEmail(normalizedEmail)) {
            logger.warn("Registration rejected, email already registered: {}", normalizedEmail);
            throw new DuplicateResourceException("User", "email", normalizedEmail);
        }

        User user = userRepository.save(User.builder()
                .name(name)
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(password))
                .phone(phone)
                .address(address)
                .isActive(true)
                .build());

        logger.info("Registered user {}", user.getUserId());
        return user;
    }

    /**
     * Get an active user.
     *
     * @throws ResourceNotFoundException if missing or deactivated
     */
    @Transactional(readOnly = true)
    public User getUser(String userId) {
        return userRepository.findById(userId)
                .filter(user -> Boolean.TRUE.equals(user.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    /**
     * Update profile fields. Null arguments leave the field unchanged.
     */
    @Transactional
    public User updateUser(String userId, String name, String email, String phone, String address) {
        User user = getUser(userId);

        if (email != null) {
            String normalizedEmail = normalizeEmail(email);
            if (!normalizedEmail.equals(user.getEmail()) && userRepository.existsByEmail(normalizedEmail)) {
                throw new DuplicateResourceException("User", "email", normalizedEmail);
            }
            user.setEmail(normalizedEmail);
        }
        if (name != null) {
            user.setName(name);
        }
        if (phone != null) {
            user.setPhone(phone);
        }
        if (address != null) {
            user.setAddress(address);
        }

        logger.info("Updated user {}", userId);
        return userRepository.save(user);
    }

    /**
     * Soft delete a user and revoke their tokens. Admin deletions are audited.
     */
    @Transactional
    public void deactivateUser(String userId) {
        User user = getUser(userId);
        String before = SecurityUtils.isAdmin() ? auditService.snapshot(user) : null;

        user.setIsActive(false);
        userRepository.save(user);
        authenticationService.revokeAllTokens(userId);

        if (SecurityUtils.isAdmin()) {
            auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.DELETE, "users", userId, before, user);
        }
        logger.info("Deactivated user {}", userId);
    }

    @Transactional(readOnly = true)
    public Page<User> listUsers(Pageable pageable) {
        return userRepository.findAll(pageable);
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
