package dev.taskworker.worker.log;

public interface LogConsumer {

    void write(String chunk);

    /** Called once after the last chunk has been written. */
    default void end() {}
}
