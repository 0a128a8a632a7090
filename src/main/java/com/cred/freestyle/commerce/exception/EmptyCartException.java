package com.cred.freestyle.commerce.exception;

/**
 * Exception thrown when checkout is attempted with an empty cart.
 *
 * @author Commerce Platform Team
 */
public class EmptyCartException extends RuntimeException {

    private final String userId;

    public EmptyCartException(String userId) {
        super(String.format("Cart for user %s is empty", userId));
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
