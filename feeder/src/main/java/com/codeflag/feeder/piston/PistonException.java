package com.codeflag.feeder.piston;

/**
 * Thrown when a call to the execution engine does not yield a usable response.
 *
 * The kind tells the caller which result status to report; {@link #getStatusCode()}
 * carries the HTTP status for {@link Kind#HTTP_STATUS} and {@link Kind#RATE_LIMITED}.
 */
public class PistonException extends RuntimeException {

    public enum Kind { TIMEOUT, CONNECTION, RATE_LIMITED, HTTP_STATUS, RESPONSE }

    private final Kind kind;
    private final int  statusCode;

    public PistonException(Kind kind, String message) {
        this(kind, 0, message, null);
    }

    public PistonException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public PistonException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind()      { return kind; }

    public int getStatusCode() { return statusCode; }
}
