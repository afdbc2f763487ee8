package com.syncwatch.refresh.tracking;

import com.syncwatch.common.PollBackoff;
import com.syncwatch.domain.ItemSyncSignal;
import com.syncwatch.domain.RefreshJobMetrics;
import com.syncwatch.domain.RefreshStatus;
import com.syncwatch.refresh.probe.ProbeErrors;
import com.syncwatch.refresh.probe.StatusProbe;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks one provider-side refresh over a fixed set of items until every item is observed refreshed,
 * the wait deadline elapses, the caller cancels, or the probe fails fatally.
 *
 * <p>Thread-safety: status and endTime live in one atomic {@link Phase}; lastCheck, checkCount and the cancel
 * flag are atomics; progress and lastError each have their own lock and are never held together. All public
 * methods may be called concurrently with a running {@link #await(Duration)}.
 *
 * <p>Probe calls made by {@code await} run on the probe executor and are bounded by the remaining wait time
 * and by {@link #cancel()}; an abandoned call has its thread interrupted. Probe rounds are numbered when they
 * start and only a round newer than the last applied one may update progress. Once the job is terminal,
 * progress is frozen.
 */
@Slf4j
public final class RefreshJob {

    private static final Phase PENDING = new Phase(RefreshStatus.PENDING, null);
    private static final Phase IN_PROGRESS = new Phase(RefreshStatus.IN_PROGRESS, null);

    private final String id;
    private final List<String> itemIds;
    private final StatusProbe statusProbe;
    private final PollBackoff backoff;
    private final Clock clock;
    private final Executor probeExecutor;
    private final Instant startTime;

    private final AtomicReference<Phase> phase = new AtomicReference<>(PENDING);
    private final AtomicReference<Instant> lastCheck = new AtomicReference<>();
    private final AtomicInteger checkCount = new AtomicInteger();
    private final AtomicLong probeRounds = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final AtomicReference<FutureTask<List<ItemSyncSignal>>> inFlight = new AtomicReference<>();

    private final Map<String, Boolean> progress;
    private long appliedRound;
    private final ReentrantReadWriteLock progressLock = new ReentrantReadWriteLock();

    private Throwable lastError;
    private final ReentrantReadWriteLock errorLock = new ReentrantReadWriteLock();

    public RefreshJob(List<String> itemIds, StatusProbe statusProbe) {
        this(itemIds, statusProbe, PollBackoff.defaultBackoff(), Clock.systemUTC());
    }

    public RefreshJob(List<String> itemIds, StatusProbe statusProbe, PollBackoff backoff, Clock clock) {
        this(itemIds, statusProbe, backoff, clock, null);
    }

    /**
     * @param probeExecutor runs probe calls made while awaiting; a shared daemon pool when null
     */
    public RefreshJob(List<String> itemIds, StatusProbe statusProbe, PollBackoff backoff, Clock clock,
                      Executor probeExecutor) {
        if (itemIds == null || itemIds.isEmpty()) {
            throw new IllegalArgumentException("At least one item id required");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String itemId : itemIds) {
            if (itemId == null || itemId.isBlank()) {
                throw new IllegalArgumentException("Item ids must not be blank");
            }
            unique.add(itemId);
        }
        this.id = "refresh-" + UUID.randomUUID();
        this.itemIds = List.copyOf(unique);
        this.statusProbe = Objects.requireNonNull(statusProbe, "statusProbe");
        this.backoff = backoff != null ? backoff : PollBackoff.defaultBackoff();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.probeExecutor = probeExecutor != null ? probeExecutor : DefaultProbeExecutor.INSTANCE;
        this.startTime = this.clock.instant();

        Map<String, Boolean> initial = new LinkedHashMap<>();
        for (String itemId : this.itemIds) {
            initial.put(itemId, Boolean.FALSE);
        }
        this.progress = initial;
    }

    public String getId() {
        return id;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public RefreshStatus getStatus() {
        return phase.get().status();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(phase.get().endTime());
    }

    public int getCheckCount() {
        return checkCount.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Blocks until the refresh finishes or {@code timeout} elapses.
     * Returns normally only when the job is COMPLETED.
     *
     * @throws RefreshFailedException    a probe error was not retryable (probe error is the cause)
     * @throws RefreshCancelledException {@link #cancel()} was called or the waiting thread was interrupted
     * @throws RefreshTimeoutException   timeout elapsed first, including while a probe call was running
     */
    public void await(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        phase.compareAndSet(PENDING, IN_PROGRESS);
        RefreshStatus observed = getStatus();
        if (observed.isTerminal()) {
            throwIfNotCompleted(observed);
            return;
        }
        log.info("Refresh job {} waiting on {} items (timeout {})", id, itemIds.size(), timeout);

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            observed = getStatus();
            if (observed.isTerminal()) {
                throwIfNotCompleted(observed);
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                finishOnDeadline(timeout);
                return;
            }
            long interval = backoff.intervalFor(checkCount.get()).toNanos();
            if (sleepUntilNextCheck(Math.min(interval, remaining)) || cancelled.get()) {
                finishCancelled();
                return;
            }
            if (interval >= remaining) {
                // deadline reached while sleeping
                continue;
            }

            int attempt = checkCount.incrementAndGet();
            long round = probeRounds.incrementAndGet();
            lastCheck.set(clock.instant());
            FutureTask<List<ItemSyncSignal>> call = new FutureTask<>(() -> statusProbe.check(itemIds));
            List<ItemSyncSignal> signals;
            inFlight.set(call);
            try {
                if (cancelled.get()) {
                    call.cancel(true);
                } else {
                    probeExecutor.execute(call);
                }
                signals = call.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                call.cancel(true);
                log.debug("Refresh job {} check #{} still running at the deadline, abandoned", id, attempt);
                finishOnDeadline(timeout);
                return;
            } catch (CancellationException e) {
                finishCancelled();
                return;
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                log.info("Refresh job {} wait interrupted during check #{}, cancelling", id, attempt);
                cancel();
                finishCancelled();
                return;
            } catch (ExecutionException e) {
                if (onProbeFailure(attempt, e.getCause())) {
                    continue;
                }
                return;
            } catch (RejectedExecutionException e) {
                if (onProbeFailure(attempt, e)) {
                    continue;
                }
                return;
            } finally {
                inFlight.compareAndSet(call, null);
            }

            if (cancelled.get()) {
                finishCancelled();
                return;
            }
            if (deadline - System.nanoTime() <= 0) {
                finishOnDeadline(timeout);
                return;
            }
            if (applyRound(round, signals, true)) {
                log.info("Refresh job {} COMPLETED after {} checks", id, attempt);
                return;
            }
            log.debug("Refresh job {} check #{}: not complete yet", id, attempt);
        }
    }

    /**
     * Non-blocking completion check. PENDING returns false without probing; IN_PROGRESS makes one probe call
     * on the calling thread.
     *
     * @throws RefreshFailedException if the job already FAILED
     */
    public boolean isComplete() {
        RefreshStatus current = getStatus();
        return switch (current) {
            case COMPLETED -> true;
            case CANCELLED, TIMED_OUT, PENDING -> false;
            case FAILED -> throw new RefreshFailedException(id, "Refresh job " + id + " failed", getLastError());
            case IN_PROGRESS -> checkStatus();
        };
    }

    /**
     * Cancels the job, wakes any waiting {@link #await(Duration)} and interrupts its running probe call.
     * Idempotent; no-op once terminal.
     */
    public void cancel() {
        if (getStatus().isTerminal()) {
            return;
        }
        cancelled.set(true);
        cancelSignal.countDown();
        FutureTask<List<ItemSyncSignal>> call = inFlight.get();
        if (call != null) {
            call.cancel(true);
        }
        if (transitionTo(RefreshStatus.CANCELLED)) {
            log.info("Refresh job {} CANCELLED", id);
        }
    }

    /**
     * Copy of item id -> observed refreshed, in item order.
     */
    public Map<String, Boolean> getProgress() {
        progressLock.readLock().lock();
        try {
            return new LinkedHashMap<>(progress);
        } finally {
            progressLock.readLock().unlock();
        }
    }

    public Throwable getLastError() {
        errorLock.readLock().lock();
        try {
            return lastError;
        } finally {
            errorLock.readLock().unlock();
        }
    }

    public RefreshJobMetrics getMetrics() {
        Phase current = phase.get();
        Instant end = current.endTime();
        Duration duration = Duration.between(startTime, end != null ? end : clock.instant());
        if (duration.isNegative()) {
            duration = Duration.ZERO;
        }
        int completed = 0;
        for (Boolean done : getProgress().values()) {
            if (Boolean.TRUE.equals(done)) {
                completed++;
            }
        }
        return new RefreshJobMetrics(
                id,
                current.status(),
                startTime,
                end,
                duration,
                itemIds.size(),
                completed,
                checkCount.get(),
                lastCheck.get(),
                getLastError());
    }

    /**
     * One probe round on the calling thread: updates progress for the tracked items and returns true when all
     * are refreshed. Does not count as a check and never changes the status.
     */
    boolean checkStatus() {
        long round = probeRounds.incrementAndGet();
        lastCheck.set(clock.instant());
        return applyRound(round, statusProbe.check(itemIds), false);
    }

    /**
     * Applies the signals of probe round {@code round} unless the job is terminal or a newer round was already
     * applied. Signals for unknown items are ignored; items missing from the response keep their last value.
     * With {@code completeOnSuccess}, the COMPLETED transition happens under the progress lock so a completed
     * job always shows every item refreshed.
     *
     * @return all items refreshed; with {@code completeOnSuccess}, true only if this call completed the job
     */
    private boolean applyRound(long round, List<ItemSyncSignal> signals, boolean completeOnSuccess) {
        progressLock.writeLock().lock();
        try {
            if (getStatus().isTerminal()) {
                return !completeOnSuccess && allRefreshed();
            }
            if (round > appliedRound) {
                appliedRound = round;
                for (ItemSyncSignal signal : signals != null ? signals : Collections.<ItemSyncSignal>emptyList()) {
                    if (signal == null || !progress.containsKey(signal.itemId())) {
                        continue;
                    }
                    progress.put(signal.itemId(), signal.isRefreshedSince(startTime));
                }
            }
            boolean all = allRefreshed();
            if (all && completeOnSuccess) {
                return transitionTo(RefreshStatus.COMPLETED);
            }
            return all;
        } finally {
            progressLock.writeLock().unlock();
        }
    }

    private boolean allRefreshed() {
        return !progress.containsValue(Boolean.FALSE);
    }

    /**
     * Records a failed probe call. Retryable errors keep the loop going; anything else fails the job.
     *
     * @return true to keep polling
     */
    private boolean onProbeFailure(int attempt, Throwable error) {
        setError(error);
        if (error instanceof Error fatal) {
            transitionTo(RefreshStatus.FAILED);
            log.error("Refresh job {} FAILED on check #{} with {}", id, attempt, fatal.toString());
            throw fatal;
        }
        if (ProbeErrors.isRetryable(error)) {
            log.warn("Refresh job {} check #{} failed (retrying): {}", id, attempt, error.getMessage());
            return true;
        }
        if (transitionTo(RefreshStatus.FAILED)) {
            if (ProbeErrors.isAuthError(error)) {
                log.warn("Refresh job {} FAILED on check #{}: re-authentication required ({})",
                        id, attempt, error.getMessage());
            } else {
                log.warn("Refresh job {} FAILED on check #{}: {}", id, attempt, error.getMessage());
            }
            throw new RefreshFailedException(id, "Refresh job " + id + " failed: " + error.getMessage(), error);
        }
        throwIfNotCompleted(getStatus());
        return false;
    }

    private void setError(Throwable error) {
        errorLock.writeLock().lock();
        try {
            lastError = error;
        } finally {
            errorLock.writeLock().unlock();
        }
    }

    /**
     * CAS from any non-terminal phase; the terminal phase carries endTime. False if another transition won.
     */
    private boolean transitionTo(RefreshStatus terminal) {
        while (true) {
            Phase current = phase.get();
            if (current.status().isTerminal()) {
                return false;
            }
            if (phase.compareAndSet(current, new Phase(terminal, clock.instant()))) {
                return true;
            }
        }
    }

    private void finishCancelled() {
        transitionTo(RefreshStatus.CANCELLED);
        throwIfNotCompleted(getStatus());
    }

    private void finishOnDeadline(Duration timeout) {
        if (cancelled.get()) {
            transitionTo(RefreshStatus.CANCELLED);
        } else if (transitionTo(RefreshStatus.TIMED_OUT)) {
            log.warn("Refresh job {} TIMED_OUT after {} ({} checks, {}/{} items done)",
                    id, timeout, checkCount.get(), completedCount(), itemIds.size());
        }
        throwIfNotCompleted(getStatus());
    }

    private int completedCount() {
        progressLock.readLock().lock();
        try {
            return (int) progress.values().stream().filter(Boolean.TRUE::equals).count();
        } finally {
            progressLock.readLock().unlock();
        }
    }

    /**
     * @return true if woken by cancellation
     */
    private boolean sleepUntilNextCheck(long nanos) {
        try {
            return cancelSignal.await(nanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Refresh job {} wait interrupted, cancelling", id);
            cancel();
            return true;
        }
    }

    private void throwIfNotCompleted(RefreshStatus terminal) {
        switch (terminal) {
            case COMPLETED -> {
            }
            case CANCELLED -> throw new RefreshCancelledException(id);
            case TIMED_OUT -> throw new RefreshTimeoutException(id, "Refresh job " + id + " timed out");
            case FAILED -> throw new RefreshFailedException(id, "Refresh job " + id + " failed", getLastError());
            default -> throw new IllegalStateException("Refresh job " + id + " is not terminal: " + terminal);
        }
    }

    /**
     * Status and the instant it was entered; endTime is null until the status is terminal.
     */
    private record Phase(RefreshStatus status, Instant endTime) {
    }

    /**
     * Fallback for jobs built without an executor.
     */
    private static final class DefaultProbeExecutor {

        static final ExecutorService INSTANCE = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable task) {
                Thread thread = new Thread(task, "refresh-probe-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }
}
