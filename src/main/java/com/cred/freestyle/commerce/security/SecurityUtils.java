package com.cred.freestyle.commerce.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;

/**
 * Utility class for security and authorization operations.
 * Provides helper methods for checking permissions and extracting the caller's identity.
 *
 * @author Commerce Platform Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated principal ID (user ID or admin ID).
     *
     * @return Principal ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
            if (principal instanceof UserDetails) {
                return ((UserDetails) principal).getUsername();
            }
        }

        return null;
    }

    /**
     * Get the current principal ID or fail.
     *
     * @return Principal ID
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }

    /**
     * Check if the current principal has a specific role.
     *
     * @param role Role to check (without ROLE_ prefix)
     * @return true if the principal has the role
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;

        return authentication.getAuthorities().stream()
            .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Verify that the current principal owns the resource or is an admin.
     *
     * @param userId Owner of the resource
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyUserAccess(String userId) {
        String currentUserId = requireCurrentUserId();

        // Admins can access any user's resources
        if (isAdmin()) {
            return;
        }

        if (!currentUserId.equals(userId)) {
            throw new AccessDeniedException(
                "Access denied: User " + currentUserId + " cannot access resources for user " + userId
            );
        }
    }
}
