package dev.taskworker.worker.feature;

public class FeatureException extends RuntimeException {

    public FeatureException(String message) {
        super(message);
    }

    public FeatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
