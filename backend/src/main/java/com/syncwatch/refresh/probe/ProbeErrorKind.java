package com.syncwatch.refresh.probe;

/**
 * Category of a status probe failure. Drives the retryable/fatal split in {@link ProbeErrors}.
 */
public enum ProbeErrorKind {
    RATE_LIMITED,
    TIMEOUT,
    SERVER_ERROR,
    NOT_AUTHENTICATED,
    SESSION_EXPIRED,
    INVALID_REQUEST,
    NOT_FOUND,
    UNKNOWN
}
