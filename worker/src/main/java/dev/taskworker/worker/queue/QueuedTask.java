package dev.taskworker.worker.queue;

import java.time.Instant;

public record QueuedTask(
    String taskId,
    int runId,
    String payloadJson,
    int retriesLeft,
    Instant deadline
) {}
