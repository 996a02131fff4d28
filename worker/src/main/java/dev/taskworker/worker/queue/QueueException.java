package dev.taskworker.worker.queue;

public class QueueException extends RuntimeException {

    private final boolean retryable;

    public QueueException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public QueueException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
