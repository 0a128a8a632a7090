package com.cred.freestyle.commerce.exception;

/**
 * Exception thrown when a write could not acquire its row locks (or lost an
 * optimistic version check) after all retry attempts. Nothing was written;
 * the client may retry the request.
 *
 * @author Commerce Platform Team
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final int attempts;

    public ConcurrencyConflictException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRetryable() {
        return true;
    }
}
