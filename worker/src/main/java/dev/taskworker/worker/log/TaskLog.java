package dev.taskworker.worker.log;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered transcript of a task run. Everything written here (the worker's own lifecycle lines
 * and the container's output) reaches every attached consumer in write order.
 *
 * <p>While held, writes are buffered and nothing is delivered; {@link #release()} flushes the
 * buffer and switches to pass-through. This lets consumers attach before the header line goes
 * out. {@link #end()} flushes whatever is still buffered, ends every consumer and completes the
 * returned future only after that.
 */
public class TaskLog {

    private static final Logger logger = LoggerFactory.getLogger(TaskLog.class);

    private final List<LogConsumer> consumers = new ArrayList<>();
    private final List<String> buffer = new ArrayList<>();
    private final CompletableFuture<Void> ended = new CompletableFuture<>();
    private boolean held;
    private boolean closed;

    public synchronized void attach(LogConsumer consumer) {
        if (closed) {
            throw new IllegalStateException("Log already ended");
        }
        consumers.add(consumer);
    }

    public synchronized void hold() {
        held = true;
    }

    public synchronized void release() {
        held = false;
        flush();
    }

    public synchronized boolean isHeld() {
        return held;
    }

    public synchronized void write(String chunk) {
        if (closed) {
            logger.warn("Dropping {} chars written after the task log ended", chunk.length());
            return;
        }
        if (held) {
            buffer.add(chunk);
            return;
        }
        deliver(chunk);
    }

    /**
     * Every consumer is ended even if an earlier one fails; the first failure is thrown with
     * the others suppressed, after the returned future has completed.
     */
    public CompletableFuture<Void> end() {
        synchronized (this) {
            if (!closed) {
                closed = true;
                held = false;
                try {
                    flush();
                } finally {
                    endConsumers();
                }
            }
        }
        return ended;
    }

    private void endConsumers() {
        RuntimeException failure = null;
        try {
            for (var consumer : consumers) {
                try {
                    consumer.end();
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            ended.complete(null);
        }
        if (failure != null) {
            throw failure;
        }
    }

    public synchronized boolean isEnded() {
        return closed;
    }

    private void flush() {
        for (var chunk : buffer) {
            deliver(chunk);
        }
        buffer.clear();
    }

    private void deliver(String chunk) {
        for (var consumer : consumers) {
            consumer.write(chunk);
        }
    }
}
