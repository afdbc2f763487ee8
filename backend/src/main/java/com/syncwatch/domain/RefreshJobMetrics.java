package com.syncwatch.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time snapshot of a refresh job.
 * {@code endTime}, {@code lastCheck} and {@code lastError} are null until set.
 */
public record RefreshJobMetrics(
        String id,
        RefreshStatus status,
        Instant startTime,
        Instant endTime,
        Duration duration,
        int itemCount,
        int completedCount,
        int checkCount,
        Instant lastCheck,
        Throwable lastError
) {
}
