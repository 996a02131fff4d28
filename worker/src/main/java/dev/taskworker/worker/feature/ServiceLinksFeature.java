package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.ContainerLink;
import dev.taskworker.worker.container.ContainerRuntime;
import dev.taskworker.worker.log.TaskLogFormat;
import dev.taskworker.worker.task.Task;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Starts the payload's service containers and links them into the task container. */
public class ServiceLinksFeature implements Feature {

    private static final Logger logger = LoggerFactory.getLogger(ServiceLinksFeature.class);

    private final ContainerRuntime runtime;
    private final List<String> started = new ArrayList<>();

    public ServiceLinksFeature(ContainerRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public List<ContainerLink> link(Task task) {
        var links = new ArrayList<ContainerLink>();
        for (var service : task.payload().services()) {
            var name = containerName(task, service.alias());
            started.add(runtime.startService(service.image(), name));
            links.add(new ContainerLink(name, service.alias()));
            task.log().write(TaskLogFormat.line("Linked service %s as %s", service.image(), service.alias()));
        }
        return links;
    }

    @Override
    public void killed(Task task) {
        FeatureException failure = null;
        for (var containerId : started) {
            try {
                runtime.removeService(containerId);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = new FeatureException("Failed to remove service container " + containerId, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        logger.debug("Released {} service container(s) for task {}", started.size(), task.taskId());
        started.clear();
        if (failure != null) {
            throw failure;
        }
    }

    static String containerName(Task task, String alias) {
        var raw = "task-" + task.taskId() + "-" + task.runId() + "-" + alias;
        return raw.replaceAll("[^a-zA-Z0-9_.-]", "_");
    }
}
