package dev.taskworker.worker.task;

import dev.taskworker.worker.container.ContainerRuntime;
import dev.taskworker.worker.lease.ReclaimPolicy;
import dev.taskworker.worker.queue.QueueClient;
import dev.taskworker.worker.schema.PayloadValidator;
import dev.taskworker.worker.stats.Stats;
import dev.taskworker.worker.timer.TimerService;
import java.time.Duration;

/** Collaborators shared by every task run of this worker process. */
public record WorkerRuntime(
    String workerId,
    String workerGroup,
    QueueClient queue,
    ContainerRuntime containers,
    PayloadValidator validator,
    Stats stats,
    TimerService timers,
    ReclaimPolicy reclaimPolicy,
    Duration outputDrainTimeout
) {}
