package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.ContainerLink;
import dev.taskworker.worker.task.Task;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The features enabled for one task. Every dispatch point calls the enabled features one after
 * another in registry order; the first failure stops the remaining hooks of that dispatch point
 * and propagates as a {@link FeatureException}.
 */
public class FeaturePipeline {

    private static final Logger logger = LoggerFactory.getLogger(FeaturePipeline.class);

    private record Enabled(String name, Feature feature) {}

    private final List<Enabled> features;

    private FeaturePipeline(List<Enabled> features) {
        this.features = features;
    }

    /**
     * A feature is enabled if the payload flags name it explicitly, otherwise if its registry
     * default is on.
     */
    public static FeaturePipeline assemble(FeatureRegistry registry, Map<String, Boolean> flags) {
        var enabled = new ArrayList<Enabled>();
        for (var entry : registry.entries()) {
            boolean on = flags.containsKey(entry.name())
                    ? flags.get(entry.name())
                    : entry.enabledByDefault();
            if (on) {
                enabled.add(new Enabled(entry.name(), entry.factory().get()));
            }
        }
        return new FeaturePipeline(List.copyOf(enabled));
    }

    public List<String> enabledFeatures() {
        return features.stream().map(Enabled::name).toList();
    }

    public List<ContainerLink> link(Task task) {
        var links = new ArrayList<ContainerLink>();
        for (var enabled : features) {
            try {
                links.addAll(enabled.feature().link(task));
            } catch (RuntimeException e) {
                throw failure(enabled, "link", e);
            }
        }
        return links;
    }

    public void created(Task task) {
        dispatch("created", feature -> feature.created(task));
    }

    public void stopped(Task task) {
        dispatch("stopped", feature -> feature.stopped(task));
    }

    public void killed(Task task) {
        dispatch("killed", feature -> feature.killed(task));
    }

    private void dispatch(String hook, Consumer<Feature> invocation) {
        for (var enabled : features) {
            logger.debug("Running {} hook of feature {}", hook, enabled.name());
            try {
                invocation.accept(enabled.feature());
            } catch (RuntimeException e) {
                throw failure(enabled, hook, e);
            }
        }
    }

    private static FeatureException failure(Enabled enabled, String hook, RuntimeException cause) {
        if (cause instanceof FeatureException featureException) {
            return featureException;
        }
        return new FeatureException(
                "Feature " + enabled.name() + " failed during " + hook + ": " + cause.getMessage(), cause);
    }
}
