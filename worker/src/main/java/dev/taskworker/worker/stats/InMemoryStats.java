package dev.taskworker.worker.stats;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Process-wide counters shared by every concurrent task run. */
public class InMemoryStats implements Stats {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStats.class);

    private final ConcurrentHashMap<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    @Override
    public void increment(String name) {
        counters.computeIfAbsent(name, k -> new LongAdder()).increment();
    }

    @Override
    public void gauge(String name, long value) {
        gauges.computeIfAbsent(name, k -> new AtomicLong()).set(value);
    }

    @Override
    public <T> T time(String name, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(name, System.nanoTime() - start);
        }
    }

    @Override
    public void time(String name, Runnable action) {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(name, System.nanoTime() - start);
        }
    }

    public long counter(String name) {
        var adder = counters.get(name);
        return adder == null ? 0 : adder.sum();
    }

    public Long gaugeValue(String name) {
        var gauge = gauges.get(name);
        return gauge == null ? null : gauge.get();
    }

    public long timerCount(String name) {
        var timer = timers.get(name);
        return timer == null ? 0 : timer.count.sum();
    }

    public Map<String, Long> snapshot() {
        var snapshot = new TreeMap<String, Long>();
        counters.forEach((name, adder) -> snapshot.put(name, adder.sum()));
        gauges.forEach((name, gauge) -> snapshot.put(name, gauge.get()));
        timers.forEach((name, timer) -> {
            snapshot.put(name + ".count", timer.count.sum());
            snapshot.put(name + ".totalMs", timer.totalNanos.sum() / 1_000_000);
        });
        return snapshot;
    }

    public void logSnapshot() {
        snapshot().forEach((name, value) -> logger.info("stat {}={}", name, value));
    }

    private void record(String name, long nanos) {
        var timer = timers.computeIfAbsent(name, k -> new Timer());
        timer.count.increment();
        timer.totalNanos.add(nanos);
        logger.debug("{} took {}ms", name, nanos / 1_000_000);
    }

    private static final class Timer {
        final LongAdder count = new LongAdder();
        final LongAdder totalNanos = new LongAdder();
    }
}
