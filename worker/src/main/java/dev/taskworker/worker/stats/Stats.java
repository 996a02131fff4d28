package dev.taskworker.worker.stats;

import java.util.function.Supplier;

public interface Stats {

    void increment(String name);

    void gauge(String name, long value);

    <T> T time(String name, Supplier<T> action);

    void time(String name, Runnable action);
}
