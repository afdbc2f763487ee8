package com.syncwatch.refresh.tracking;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory registry of refresh jobs keyed by job id.
 * The lock guards map membership only; job state is read outside of it.
 */
@Slf4j
public class RefreshJobManager {

    private final Map<String, RefreshJob> jobs = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public RefreshJobManager() {
        this(Clock.systemUTC());
    }

    public RefreshJobManager(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Registers the job; an existing job with the same id is replaced.
     */
    public void addJob(RefreshJob job) {
        Objects.requireNonNull(job, "job");
        lock.writeLock().lock();
        try {
            jobs.put(job.getId(), job);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<RefreshJob> getJob(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RefreshJob> listJobs() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return jobs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes terminal jobs whose endTime is older than now - olderThan.
     * Jobs without an endTime (pending or in progress) are never removed.
     *
     * @return number of jobs removed
     */
    public int cleanupCompleted(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        Instant cutoff = clock.instant().minus(olderThan);

        List<RefreshJob> expired = new ArrayList<>();
        for (RefreshJob job : listJobs()) {
            Optional<Instant> end = job.getEndTime();
            if (job.getStatus().isTerminal() && end.isPresent() && end.get().isBefore(cutoff)) {
                expired.add(job);
            }
        }
        if (expired.isEmpty()) {
            return 0;
        }

        int removed = 0;
        lock.writeLock().lock();
        try {
            for (RefreshJob job : expired) {
                if (jobs.remove(job.getId(), job)) {
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Removed {} refresh jobs finished before {}", removed, cutoff);
        return removed;
    }
}
