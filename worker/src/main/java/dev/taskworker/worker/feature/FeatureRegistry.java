package dev.taskworker.worker.feature;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Known features in registration order. Order is significant: hooks at every dispatch point run
 * in this order, so a feature may rely on the side effects of one registered before it.
 */
public final class FeatureRegistry {

    public record Entry(String name, boolean enabledByDefault, Supplier<Feature> factory) {}

    private final List<Entry> entries;

    private FeatureRegistry(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<Entry> entries() {
        return entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();

        public Builder register(String name, boolean enabledByDefault, Supplier<Feature> factory) {
            if (entries.stream().anyMatch(e -> e.name().equals(name))) {
                throw new IllegalArgumentException("Feature already registered: " + name);
            }
            entries.add(new Entry(name, enabledByDefault, factory));
            return this;
        }

        public FeatureRegistry build() {
            return new FeatureRegistry(entries);
        }
    }
}
