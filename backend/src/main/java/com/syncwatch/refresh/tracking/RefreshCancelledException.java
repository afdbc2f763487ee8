package com.syncwatch.refresh.tracking;

/**
 * Job was cancelled by its caller (explicit cancel or interrupted wait).
 */
public class RefreshCancelledException extends RefreshException {

    public RefreshCancelledException(String jobId) {
        super(jobId, "Refresh job " + jobId + " was cancelled");
    }
}
