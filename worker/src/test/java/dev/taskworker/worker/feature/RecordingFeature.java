package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.ContainerLink;
import dev.taskworker.worker.task.Task;
import java.util.List;

/** Appends "name.hook" to a shared event list at every dispatch point. */
public class RecordingFeature implements Feature {

    private final String name;
    private final List<String> events;
    private final List<ContainerLink> links;
    private String failingHook;

    public RecordingFeature(String name, List<String> events) {
        this(name, events, List.of());
    }

    public RecordingFeature(String name, List<String> events, List<ContainerLink> links) {
        this.name = name;
        this.events = events;
        this.links = links;
    }

    public RecordingFeature failingAt(String hook) {
        this.failingHook = hook;
        return this;
    }

    @Override
    public List<ContainerLink> link(Task task) {
        record("link");
        return links;
    }

    @Override
    public void created(Task task) {
        record("created");
    }

    @Override
    public void stopped(Task task) {
        record("stopped");
    }

    @Override
    public void killed(Task task) {
        record("killed");
    }

    private void record(String hook) {
        events.add(name + "." + hook);
        if (hook.equals(failingHook)) {
            throw new IllegalStateException(name + " broke in " + hook);
        }
    }
}
