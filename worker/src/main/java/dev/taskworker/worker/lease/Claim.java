package dev.taskworker.worker.lease;

import java.time.Instant;

public record Claim(String workerId, String workerGroup, Instant takenUntil) {}
