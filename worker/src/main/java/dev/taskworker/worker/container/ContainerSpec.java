package dev.taskworker.worker.container;

import dev.taskworker.worker.task.TaskPayload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ContainerSpec(
    String image,
    List<String> command,
    List<String> env,
    List<ContainerLink> links
) {

    /**
     * Builds the container configuration for a run. Injected variables win over payload
     * variables of the same name; the payload itself is not modified.
     */
    public static ContainerSpec configure(TaskPayload payload, Map<String, String> injectedEnv,
                                          List<ContainerLink> links) {
        var merged = new LinkedHashMap<>(payload.env());
        merged.putAll(injectedEnv);

        var env = new ArrayList<String>(merged.size());
        merged.forEach((name, value) -> env.add(name + "=" + value));

        return new ContainerSpec(
                payload.image(),
                List.copyOf(payload.command()),
                List.copyOf(env),
                links == null ? List.of() : List.copyOf(links));
    }
}
