package dev.taskworker.worker;

import dev.taskworker.worker.lease.ReclaimPolicy;
import java.nio.file.Path;
import java.time.Duration;

public record WorkerConfig(
    String queueTarget,
    String queueToken,
    String workerId,
    String workerGroup,
    int capacity,
    Duration pollInterval,
    Path logDir,
    Path artifactDir,
    ReclaimPolicy reclaimPolicy,
    String runStateTable
) {

    public WorkerConfig {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (workerGroup == null || workerGroup.isBlank()) {
            throw new IllegalArgumentException("workerGroup is required");
        }
    }
}
