package dev.taskworker.worker;

import dev.taskworker.worker.queue.QueueClient;
import dev.taskworker.worker.queue.QueuedTask;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Pulls pending tasks from the queue while the worker has spare capacity. */
public class TaskPoller {

    private static final Logger logger = LoggerFactory.getLogger(TaskPoller.class);

    @FunctionalInterface
    public interface TaskHandler {
        void handle(QueuedTask task);
    }

    private final QueueClient queue;
    private final WorkerConfig config;
    private final TaskHandler handler;
    private final Semaphore capacity;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    public TaskPoller(QueueClient queue, WorkerConfig config, TaskHandler handler) {
        this.queue = queue;
        this.config = config;
        this.handler = handler;
        this.capacity = new Semaphore(config.capacity());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "task-poller");
            thread.setDaemon(true);
            return thread;
        });
        var counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.capacity(),
                r -> new Thread(r, "task-run-" + counter.incrementAndGet()));
    }

    public void start() {
        logger.info("Task poller started, interval={}ms, capacity={}",
                config.pollInterval().toMillis(), config.capacity());
        scheduler.scheduleWithFixedDelay(
                this::poll, 0, config.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
    }

    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        workers.shutdown();
        logger.info("Waiting for {} in-flight task(s)", inFlight());
        if (!workers.awaitTermination(1, TimeUnit.HOURS)) {
            logger.warn("In-flight tasks did not finish, abandoning them");
            workers.shutdownNow();
        }
    }

    int inFlight() {
        return config.capacity() - capacity.availablePermits();
    }

    void poll() {
        try {
            while (capacity.tryAcquire()) {
                var next = fetch();
                if (next == null) {
                    capacity.release();
                    return;
                }
                if (!dispatch(next)) {
                    return;
                }
            }
        } catch (Exception e) {
            logger.error("Polling cycle failed", e);
        }
    }

    private QueuedTask fetch() {
        try {
            return queue.pollTask(config.workerGroup(), config.workerId()).orElse(null);
        } catch (RuntimeException e) {
            capacity.release();
            throw e;
        }
    }

    private boolean dispatch(QueuedTask task) {
        logger.info("Picked up task {} run {}", task.taskId(), task.runId());
        try {
            workers.execute(() -> {
                try {
                    handler.handle(task);
                } catch (RuntimeException e) {
                    logger.error("Task {} run {} failed, leaving it to be retried", task.taskId(), task.runId(), e);
                } finally {
                    capacity.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            capacity.release();
            logger.warn("Worker is shutting down, dropped task {} run {} before claiming it",
                    task.taskId(), task.runId());
            return false;
        }
    }
}
