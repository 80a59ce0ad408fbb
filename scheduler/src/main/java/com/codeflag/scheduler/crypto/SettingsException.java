package com.codeflag.scheduler.crypto;

/**
 * Thrown when an encrypted settings string cannot be turned into overrides.
 * Always the caller's fault, so always answered with 400.
 */
public class SettingsException extends RuntimeException {

    public enum Kind { INVALID_TOKEN, MALFORMED_JSON, NOT_AN_OBJECT }

    private final Kind kind;

    public SettingsException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
