package com.syncwatch.refresh.event;

import com.syncwatch.domain.RefreshJobMetrics;
import com.syncwatch.domain.RefreshStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a refresh job awaited through AccountRefreshService reaches a terminal state.
 * Carries the final metrics snapshot; no mandatory consumer.
 */
@Getter
public class RefreshJobFinishedEvent extends ApplicationEvent {

    private final String jobId;
    private final RefreshStatus status;
    private final RefreshJobMetrics metrics;

    public RefreshJobFinishedEvent(Object source, RefreshJobMetrics metrics) {
        super(source);
        this.jobId = metrics.id();
        this.status = metrics.status();
        this.metrics = metrics;
    }
}
