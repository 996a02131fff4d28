package dev.taskworker.worker.timer;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ScheduledTimerService implements TimerService, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledTimerService.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;

    public ScheduledTimerService(int threads) {
        this(threads, Clock.systemUTC());
    }

    public ScheduledTimerService(int threads, Clock clock) {
        var counter = new AtomicInteger();
        var executor = new ScheduledThreadPoolExecutor(threads, r -> {
            var thread = new Thread(r, "task-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        // A cancelled timer must not keep its task reachable until the original deadline.
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
        this.clock = clock;
    }

    @Override
    public Cancellable schedule(Runnable action, Duration delay) {
        var future = scheduler.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Timer callback failed", e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Clock clock() {
        return clock;
    }

    int queued() {
        return scheduler.getQueue().size();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
