package com.syncwatch.refresh.probe;

/**
 * Thrown when a status probe call fails (transport, HTTP status or provider error payload).
 * {@code statusCode} is 0 when there was no HTTP response.
 */
public class ProbeException extends RuntimeException {

    private final ProbeErrorKind kind;
    private final int statusCode;

    public ProbeException(ProbeErrorKind kind, String message) {
        this(kind, 0, message, null);
    }

    public ProbeException(ProbeErrorKind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public ProbeException(ProbeErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : ProbeErrorKind.UNKNOWN;
        this.statusCode = statusCode;
    }

    public ProbeErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
