package dev.taskworker.worker.queue;

import dev.taskworker.worker.lease.Claim;
import java.util.Optional;

public interface QueueClient {

    Optional<QueuedTask> pollTask(String workerGroup, String workerId);

    Claim claimTask(String taskId, int runId, String workerId, String workerGroup);

    void reportCompleted(String taskId, int runId, boolean success);
}
