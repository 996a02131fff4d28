package dev.taskworker.worker.container;

import dev.taskworker.worker.log.TaskLog;

public interface ContainerRuntime {

    /**
     * Prepares the task container without starting it. Its combined output is written to
     * {@code output} once started.
     */
    ContainerProcess create(ContainerSpec spec, TaskLog output);

    /** Starts a detached helper container under the given name, returning its id. */
    String startService(String image, String name);

    void removeService(String containerId);
}
