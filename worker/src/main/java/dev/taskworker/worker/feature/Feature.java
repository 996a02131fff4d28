package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.ContainerLink;
import dev.taskworker.worker.task.Task;
import java.util.List;

/**
 * Optional lifecycle extension around a task run. One instance is created per task; every hook
 * defaults to a no-op.
 */
public interface Feature {

    /** Before the container is configured. Returned links are added to the task container. */
    default List<ContainerLink> link(Task task) {
        return List.of();
    }

    /** Container configured but not started; the task log is still held. */
    default void created(Task task) {}

    /** Container exited and its output was drained; the footer is not yet written. */
    default void stopped(Task task) {}

    /** Container removed; final cleanup. */
    default void killed(Task task) {}
}
