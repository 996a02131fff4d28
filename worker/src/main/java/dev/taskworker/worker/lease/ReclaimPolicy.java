package dev.taskworker.worker.lease;

import java.time.Duration;

/**
 * How a failed reclaim is retried. Attempt {@code n} (1-based) is followed by a wait of
 * {@code initialBackoff * 2^(n-1)}; after {@code maxAttempts} consecutive failures the lease is
 * lost. A retry that would land after the current claim expires is never scheduled.
 */
public record ReclaimPolicy(int maxAttempts, Duration initialBackoff) {

    public static final ReclaimPolicy DEFAULT = new ReclaimPolicy(3, Duration.ofSeconds(2));

    public ReclaimPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
    }

    public Duration backoff(int failedAttempts) {
        return initialBackoff.multipliedBy(1L << Math.min(failedAttempts - 1, 20));
    }
}
