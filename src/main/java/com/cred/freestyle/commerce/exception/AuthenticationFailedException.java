package com.cred.freestyle.commerce.exception;

/**
 * Exception thrown when credentials or a bearer token cannot be verified.
 * The message never says which part of the credential was wrong.
 *
 * @author Commerce Platform Team
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
