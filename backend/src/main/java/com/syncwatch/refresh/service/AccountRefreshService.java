package com.syncwatch.refresh.service;

import com.syncwatch.common.PollBackoff;
import com.syncwatch.config.AsyncConfig;
import com.syncwatch.domain.ItemSyncSignal;
import com.syncwatch.domain.RefreshJobMetrics;
import com.syncwatch.refresh.config.RefreshConfig;
import com.syncwatch.refresh.config.RefreshProperties;
import com.syncwatch.refresh.event.RefreshJobFinishedEvent;
import com.syncwatch.refresh.probe.StatusProbe;
import com.syncwatch.refresh.tracking.RefreshJob;
import com.syncwatch.refresh.tracking.RefreshJobManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for account refreshes: asks the provider to refresh, then tracks completion with a
 * registered {@link RefreshJob}. With no item ids, every item from the {@link ItemDirectory} is refreshed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRefreshService {

    private final RefreshInitiator refreshInitiator;
    private final ItemDirectory itemDirectory;
    private final StatusProbe statusProbe;
    private final RefreshJobManager refreshJobManager;
    private final PollBackoff refreshPollBackoff;
    private final RefreshProperties refreshProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Qualifier(RefreshConfig.REFRESH_CLOCK)
    private final Clock refreshClock;

    @Qualifier(AsyncConfig.REFRESH_PROBE_EXECUTOR)
    private final Executor refreshProbeExecutor;

    /**
     * Requests the refresh and returns the registered PENDING job without waiting.
     *
     * @throws RefreshRejectedException provider did not accept the request
     */
    public RefreshJob refresh(List<String> itemIds) {
        List<String> targets = resolveItemIds(itemIds);
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("No items to refresh");
        }
        try {
            refreshInitiator.requestRefresh(targets);
        } catch (RefreshRejectedException e) {
            log.warn("Refresh request for {} items rejected ({}): {}", targets.size(), e.getCode(), e.getMessage());
            throw e;
        }
        RefreshJob job = new RefreshJob(targets, statusProbe, refreshPollBackoff, refreshClock, refreshProbeExecutor);
        refreshJobManager.addJob(job);
        log.info("Refresh job {} started for {} items", job.getId(), targets.size());
        return job;
    }

    /**
     * Refresh then block until done, using the configured default timeout.
     */
    public RefreshJobMetrics refreshAndWait(List<String> itemIds) {
        return refreshAndWait(refreshProperties.getDefaultTimeout(), itemIds);
    }

    /**
     * Refresh then block until done.
     *
     * @throws com.syncwatch.refresh.tracking.RefreshException on failure, cancellation or timeout
     */
    public RefreshJobMetrics refreshAndWait(Duration timeout, List<String> itemIds) {
        RefreshJob job = refresh(itemIds);
        return awaitAndPublish(job, timeout);
    }

    /**
     * Waits for {@code job} on the refresh executor. The future completes exceptionally with the
     * job's RefreshException on failure, cancellation or timeout.
     */
    @Async(AsyncConfig.REFRESH_EXECUTOR)
    public CompletableFuture<RefreshJobMetrics> awaitAsync(RefreshJob job, Duration timeout) {
        return CompletableFuture.completedFuture(awaitAndPublish(job, timeout));
    }

    /**
     * One-shot check without creating a job: true when none of the items reports a sync in progress.
     */
    public boolean isRefreshComplete(List<String> itemIds) {
        List<String> targets = resolveItemIds(itemIds);
        if (targets.isEmpty()) {
            return true;
        }
        Set<String> wanted = Set.copyOf(targets);
        List<ItemSyncSignal> signals = statusProbe.check(targets);
        if (signals == null) {
            return true;
        }
        return signals.stream()
                .filter(s -> s != null && wanted.contains(s.itemId()))
                .noneMatch(ItemSyncSignal::syncInProgress);
    }

    public Duration defaultTimeout() {
        return refreshProperties.getDefaultTimeout();
    }

    private RefreshJobMetrics awaitAndPublish(RefreshJob job, Duration timeout) {
        try {
            job.await(timeout);
            return job.getMetrics();
        } finally {
            RefreshJobMetrics metrics = job.getMetrics();
            log.info("Refresh job {} finished {}: {}/{} items in {} ({} checks)",
                    metrics.id(), metrics.status(), metrics.completedCount(), metrics.itemCount(),
                    metrics.duration(), metrics.checkCount());
            applicationEventPublisher.publishEvent(new RefreshJobFinishedEvent(this, metrics));
        }
    }

    private List<String> resolveItemIds(List<String> itemIds) {
        List<String> source = (itemIds == null || itemIds.isEmpty()) ? itemDirectory.listItemIds() : itemIds;
        if (source == null) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String itemId : source) {
            if (itemId != null && !itemId.isBlank()) {
                normalized.add(itemId.trim());
            }
        }
        return List.copyOf(normalized);
    }
}
