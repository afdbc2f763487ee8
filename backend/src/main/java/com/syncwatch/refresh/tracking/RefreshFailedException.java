package com.syncwatch.refresh.tracking;

/**
 * Job ended in FAILED after a non-retryable probe error; the probe error is the cause.
 */
public class RefreshFailedException extends RefreshException {

    public RefreshFailedException(String jobId, String message, Throwable cause) {
        super(jobId, message, cause);
    }
}
