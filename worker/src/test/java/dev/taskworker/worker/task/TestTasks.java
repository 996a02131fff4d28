package dev.taskworker.worker.task;

import dev.taskworker.worker.container.ContainerProcess;
import dev.taskworker.worker.feature.FeaturePipeline;
import dev.taskworker.worker.feature.FeatureRegistry;

public final class TestTasks {

    public static final String VALID_PAYLOAD = """
            {"image": "alpine:3.19", "command": ["echo", "hi"], "maxRunTime": 10}
            """;

    private TestTasks() {}

    public static Task task(String payloadJson) {
        return task(payloadJson, FeatureRegistry.builder().build());
    }

    public static Task task(String payloadJson, FeatureRegistry registry) {
        var payload = TaskPayload.parse(payloadJson);
        return new Task(
                new TaskStatus("task-1", 5, null),
                0,
                payload,
                FeaturePipeline.assemble(registry, payload.features()));
    }

    public static Task withContainer(Task task, ContainerProcess container, Integer exitCode) {
        task.attach(container);
        if (exitCode != null) {
            task.exitCode(exitCode);
        }
        return task;
    }
}
