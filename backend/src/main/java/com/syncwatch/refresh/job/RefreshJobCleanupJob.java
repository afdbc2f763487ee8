package com.syncwatch.refresh.job;

import com.syncwatch.refresh.config.RefreshProperties;
import com.syncwatch.refresh.tracking.RefreshJobManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic registry cleanup: drops terminal refresh jobs older than the configured retention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefreshJobCleanupJob {

    private final RefreshJobManager refreshJobManager;
    private final RefreshProperties refreshProperties;

    @Scheduled(
            fixedRateString = "${syncwatch.refresh.cleanup-interval-ms:600000}",
            initialDelayString = "${syncwatch.refresh.cleanup-interval-ms:600000}")
    public void runScheduled() {
        int removed = refreshJobManager.cleanupCompleted(refreshProperties.getRetention());
        if (removed > 0) {
            log.info("Refresh job cleanup removed {} jobs older than {}", removed, refreshProperties.getRetention());
        }
    }
}
