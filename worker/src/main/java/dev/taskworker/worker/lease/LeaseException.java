package dev.taskworker.worker.lease;

public class LeaseException extends RuntimeException {

    public LeaseException(String message) {
        super(message);
    }

    public LeaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
