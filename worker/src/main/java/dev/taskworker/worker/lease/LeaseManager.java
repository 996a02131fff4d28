package dev.taskworker.worker.lease;

import dev.taskworker.worker.queue.QueueClient;
import dev.taskworker.worker.queue.QueueException;
import dev.taskworker.worker.stats.Stats;
import dev.taskworker.worker.timer.Cancellable;
import dev.taskworker.worker.timer.TimerService;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the claim on one task run and keeps renewing it until cancelled.
 *
 * <p>At most one reclaim timer is pending at any time. Every (re)schedule bumps a generation
 * counter and cancels the previous handle; a timer that fires with a stale generation does
 * nothing, so a callback racing a cancel or a reschedule cannot issue a second reclaim.
 */
public class LeaseManager implements Cancellable {

    private static final Logger logger = LoggerFactory.getLogger(LeaseManager.class);

    static final double RECLAIM_DIVISOR = 1.3;

    private final QueueClient queue;
    private final TimerService timers;
    private final Stats stats;
    private final ReclaimPolicy policy;
    private final String workerId;
    private final String workerGroup;
    private final String taskId;
    private final int runId;

    private Consumer<LeaseException> onLeaseLost = e -> {};
    private Consumer<Claim> onClaimed = c -> {};
    private Claim claim;
    private Cancellable pending;
    private long generation;
    private int failedAttempts;
    private boolean cancelled;
    private LeaseException failure;

    public LeaseManager(QueueClient queue, TimerService timers, Stats stats, ReclaimPolicy policy,
                        String workerId, String workerGroup, String taskId, int runId) {
        this.queue = queue;
        this.timers = timers;
        this.stats = stats;
        this.policy = policy;
        this.workerId = workerId;
        this.workerGroup = workerGroup;
        this.taskId = taskId;
        this.runId = runId;
    }

    public synchronized void onClaimed(Consumer<Claim> listener) {
        this.onClaimed = listener;
    }

    /** Invoked from the timer thread once reclaim attempts are exhausted. */
    public synchronized void onLeaseLost(Consumer<LeaseException> listener) {
        this.onLeaseLost = listener;
    }

    /**
     * Claims (or reclaims) the task and schedules the next reclaim, replacing any pending one.
     *
     * @throws QueueException if the upstream call fails
     */
    public Claim claim() {
        var next = requestClaim();
        synchronized (this) {
            if (cancelled) {
                return next;
            }
            accept(next);
        }
        return next;
    }

    public synchronized Claim current() {
        return claim;
    }

    public synchronized Optional<LeaseException> failure() {
        return Optional.ofNullable(failure);
    }

    public void throwIfLost() {
        var lost = failure();
        if (lost.isPresent()) {
            throw lost.get();
        }
    }

    @Override
    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        generation++;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        logger.debug("Reclaim cadence stopped for task {} run {}", taskId, runId);
    }

    private void accept(Claim next) {
        claim = next;
        failedAttempts = 0;
        onClaimed.accept(next);
        scheduleLocked(nextReclaimDelay(next.takenUntil()));
    }

    Duration nextReclaimDelay(Instant takenUntil) {
        long remaining = Duration.between(timers.clock().instant(), takenUntil).toMillis();
        return Duration.ofMillis((long) (Math.max(0, remaining) / RECLAIM_DIVISOR));
    }

    private Claim requestClaim() {
        stats.increment("tasks.claims");
        return stats.time("tasks.time.claim",
                () -> queue.claimTask(taskId, runId, workerId, workerGroup));
    }

    private void scheduleLocked(Duration delay) {
        generation++;
        if (pending != null) {
            pending.cancel();
        }
        long scheduledGeneration = generation;
        pending = timers.schedule(() -> reclaim(scheduledGeneration), delay);
        logger.info("Next claim for task {} run {} in {}ms", taskId, runId, delay.toMillis());
    }

    private void reclaim(long scheduledGeneration) {
        synchronized (this) {
            if (scheduledGeneration != generation) {
                return;
            }
            pending = null;
        }

        Claim next;
        try {
            next = requestClaim();
        } catch (RuntimeException e) {
            // Any failure counts against the reclaim policy.
            handleReclaimFailure(scheduledGeneration, e);
            return;
        }

        synchronized (this) {
            if (scheduledGeneration != generation) {
                return;
            }
            accept(next);
        }
    }

    private void handleReclaimFailure(long scheduledGeneration, RuntimeException error) {
        LeaseException lost;
        Consumer<LeaseException> listener;
        synchronized (this) {
            if (scheduledGeneration != generation) {
                return;
            }
            failedAttempts++;
            var backoff = policy.backoff(failedAttempts);
            var retryAt = timers.clock().instant().plus(backoff);
            if (failedAttempts < policy.maxAttempts() && retryAt.isBefore(claim.takenUntil())) {
                logger.warn("Reclaim of task {} run {} failed (attempt {}/{}), retrying in {}ms",
                        taskId, runId, failedAttempts, policy.maxAttempts(), backoff.toMillis(), error);
                scheduleLocked(backoff);
                return;
            }
            generation++;
            failure = new LeaseException(
                    "Lost claim on task " + taskId + " run " + runId + " after "
                            + failedAttempts + " failed reclaim attempt(s)", error);
            lost = failure;
            listener = onLeaseLost;
        }
        logger.error("Claim on task {} run {} lost", taskId, runId, error);
        listener.accept(lost);
    }
}
