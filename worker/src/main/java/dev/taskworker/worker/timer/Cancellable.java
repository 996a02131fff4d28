package dev.taskworker.worker.timer;

@FunctionalInterface
public interface Cancellable {

    /**
     * Cancels the underlying activity. Calling this more than once, or after the activity
     * already ran, has no effect.
     */
    void cancel();
}
