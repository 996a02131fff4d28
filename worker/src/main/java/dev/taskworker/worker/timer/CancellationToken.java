package dev.taskworker.worker.timer;

import java.util.ArrayList;
import java.util.List;

/**
 * One token per task run. Every background timer the run owns registers here so a single
 * {@link #cancel()} stops all of them when the run concludes or fails.
 */
public final class CancellationToken implements Cancellable {

    private final List<Cancellable> registered = new ArrayList<>();
    private boolean cancelled;

    public void register(Cancellable cancellable) {
        synchronized (this) {
            if (!cancelled) {
                registered.add(cancellable);
                return;
            }
        }
        cancellable.cancel();
    }

    @Override
    public void cancel() {
        List<Cancellable> toCancel;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toCancel = List.copyOf(registered);
            registered.clear();
        }
        toCancel.forEach(Cancellable::cancel);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }
}
