package dev.taskworker.worker.queue;

import dev.taskworker.worker.lease.Claim;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

public class RecordingQueueClient implements QueueClient {

    public record Report(String taskId, int runId, boolean success) {}

    private final Clock clock;
    private final Duration leaseDuration;
    private final Deque<QueuedTask> pendingTasks = new ArrayDeque<>();
    private final List<Report> reports = new ArrayList<>();
    private int claims;
    private int failingClaimsFrom = Integer.MAX_VALUE;
    private RuntimeException claimFailure;

    public RecordingQueueClient(Clock clock, Duration leaseDuration) {
        this.clock = clock;
        this.leaseDuration = leaseDuration;
    }

    public synchronized void enqueue(QueuedTask task) {
        pendingTasks.add(task);
    }

    /** Every claim from the given (1-based) call on fails with a retryable error. */
    public synchronized void failClaimsFrom(int call) {
        failClaimsFrom(call, null);
    }

    /** Every claim from the given (1-based) call on throws {@code failure}. */
    public synchronized void failClaimsFrom(int call, RuntimeException failure) {
        this.failingClaimsFrom = call;
        this.claimFailure = failure;
    }

    public synchronized int claims() {
        return claims;
    }

    public synchronized List<Report> reports() {
        return List.copyOf(reports);
    }

    @Override
    public synchronized Optional<QueuedTask> pollTask(String workerGroup, String workerId) {
        return Optional.ofNullable(pendingTasks.poll());
    }

    @Override
    public synchronized Claim claimTask(String taskId, int runId, String workerId, String workerGroup) {
        claims++;
        if (claims >= failingClaimsFrom) {
            if (claimFailure != null) {
                throw claimFailure;
            }
            throw new QueueException("claimTask failed: UNAVAILABLE", true);
        }
        return new Claim(workerId, workerGroup, clock.instant().plus(leaseDuration));
    }

    @Override
    public synchronized void reportCompleted(String taskId, int runId, boolean success) {
        reports.add(new Report(taskId, runId, success));
    }
}
