package com.syncwatch.refresh.tracking;

/**
 * Base for refresh orchestration failures. {@code jobId} is null when no job was created.
 */
public class RefreshException extends RuntimeException {

    private final String jobId;

    public RefreshException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public RefreshException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
