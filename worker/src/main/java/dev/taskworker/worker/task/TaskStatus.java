package dev.taskworker.worker.task;

import java.time.Instant;

/** Run metadata assigned by the queue. */
public record TaskStatus(String taskId, int retriesLeft, Instant deadline) {}
