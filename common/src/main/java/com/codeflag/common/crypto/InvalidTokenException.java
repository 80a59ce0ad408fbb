package com.codeflag.common.crypto;

/**
 * Thrown when a settings token cannot be trusted: malformed, signed with a
 * different key, tampered with, or expired. Callers never learn which.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
