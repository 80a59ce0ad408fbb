package com.codeflag.scheduler.service;

/**
 * A submission that could not produce a flag. The kind decides the HTTP
 * status; the message becomes the response's {@code detail}.
 */
public class SubmissionException extends RuntimeException {

    public enum Kind { INVALID_SETTINGS, UNCONFIGURED, BROKER_UNAVAILABLE, TIMEOUT, INTERNAL }

    private final Kind kind;

    public SubmissionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SubmissionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
