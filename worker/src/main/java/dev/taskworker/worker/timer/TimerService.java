package dev.taskworker.worker.timer;

import java.time.Clock;
import java.time.Duration;

public interface TimerService {

    Cancellable schedule(Runnable action, Duration delay);

    Clock clock();
}
