package com.syncwatch.refresh.probe;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies probe failures. Retryable: rate limiting, transient timeouts and 5xx; everything else is fatal.
 */
public final class ProbeErrors {

    private static final int MAX_CAUSE_DEPTH = 16;

    private ProbeErrors() {
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ProbeException probe) {
                if (probe.getKind() == ProbeErrorKind.RATE_LIMITED
                        || probe.getKind() == ProbeErrorKind.TIMEOUT
                        || probe.getKind() == ProbeErrorKind.SERVER_ERROR) {
                    return true;
                }
                int code = probe.getStatusCode();
                if (code >= 500 || code == 429) {
                    return true;
                }
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Credential problems that need user action; never retryable.
     */
    public static boolean isAuthError(Throwable error) {
        if (error instanceof ProbeException probe) {
            return probe.getKind() == ProbeErrorKind.NOT_AUTHENTICATED
                    || probe.getKind() == ProbeErrorKind.SESSION_EXPIRED
                    || probe.getStatusCode() == 401;
        }
        return false;
    }
}
