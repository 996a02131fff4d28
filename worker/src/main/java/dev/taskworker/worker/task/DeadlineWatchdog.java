package dev.taskworker.worker.task;

import dev.taskworker.worker.container.ContainerProcess;
import dev.taskworker.worker.log.TaskLog;
import dev.taskworker.worker.log.TaskLogFormat;
import dev.taskworker.worker.stats.Stats;
import dev.taskworker.worker.timer.Cancellable;
import dev.taskworker.worker.timer.TimerService;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Kills the task container once its maximum run time has elapsed. */
public class DeadlineWatchdog implements Cancellable {

    private static final Logger logger = LoggerFactory.getLogger(DeadlineWatchdog.class);

    private final TimerService timers;
    private final ContainerProcess container;
    private final TaskLog log;
    private final Stats stats;
    private final int maxRunTimeSeconds;
    private final AtomicBoolean fired = new AtomicBoolean();

    private Cancellable pending;
    private boolean disarmed;

    public DeadlineWatchdog(TimerService timers, ContainerProcess container, TaskLog log,
                            Stats stats, int maxRunTimeSeconds) {
        this.timers = timers;
        this.container = container;
        this.log = log;
        this.stats = stats;
        this.maxRunTimeSeconds = maxRunTimeSeconds;
    }

    public synchronized void arm() {
        if (pending != null || disarmed) {
            throw new IllegalStateException("Watchdog can only be armed once");
        }
        pending = timers.schedule(this::expire, Duration.ofSeconds(maxRunTimeSeconds));
    }

    public synchronized void disarm() {
        disarmed = true;
        if (pending != null) {
            pending.cancel();
        }
    }

    @Override
    public void cancel() {
        disarm();
    }

    public boolean fired() {
        return fired.get();
    }

    private void expire() {
        synchronized (this) {
            if (disarmed || !fired.compareAndSet(false, true)) {
                return;
            }
        }
        logger.info("Run exceeded {}s, killing container", maxRunTimeSeconds);
        stats.increment("tasks.timed_out");
        stats.gauge("tasks.timed_out.max_run_time", maxRunTimeSeconds);
        container.kill();
        log.write(TaskLogFormat.timeout(maxRunTimeSeconds));
    }
}
