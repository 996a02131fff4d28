package dev.taskworker.worker.container;

import java.io.InputStream;
import java.time.Duration;

/** One task container, owned by the run that created it. */
public interface ContainerProcess {

    /** Creates and starts the container and begins streaming its output. Does not block. */
    void start();

    /** Blocks until the container exits or is killed and returns its exit code. */
    int run();

    /** Forcibly stops the container. Only the first call has an effect. */
    void kill();

    boolean killed();

    /** Waits for the output stream to reach its end after the container exited. */
    void awaitOutput(Duration timeout);

    /** Deletes the container. A container that was never started has nothing to remove. */
    void remove();

    /** Tar archive of {@code path} inside the container. */
    InputStream archive(String path);
}
