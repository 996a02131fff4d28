package dev.taskworker.worker.task;

import java.time.Duration;
import java.time.Instant;

public record RunOutcome(boolean success, int exitCode, Instant startedAt, Instant finishedAt) {

    /** Exit code reported when the payload was rejected before the container ran. */
    public static final int INFRA_ERROR_EXIT_CODE = -1;

    public static RunOutcome of(int exitCode, Instant startedAt, Instant finishedAt) {
        return new RunOutcome(exitCode == 0, exitCode, startedAt, finishedAt);
    }

    public long seconds() {
        return Duration.between(startedAt, finishedAt).toSeconds();
    }
}
