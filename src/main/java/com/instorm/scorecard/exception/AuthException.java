package com.instorm.scorecard.exception;

/**
 * Raised when credentials are rejected or an authorized call reports that the
 * bearer token is no longer accepted. Recoverable by logging in again.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
