package com.syncwatch.refresh.tracking;

/**
 * Wait deadline elapsed before every item was observed refreshed.
 */
public class RefreshTimeoutException extends RefreshException {

    public RefreshTimeoutException(String jobId, String message) {
        super(jobId, message);
    }
}
