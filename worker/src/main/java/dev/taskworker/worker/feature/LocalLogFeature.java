package dev.taskworker.worker.feature;

import dev.taskworker.worker.log.FileLogConsumer;
import dev.taskworker.worker.task.Task;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Persists the full task transcript to {@code <logDir>/<taskId>/<runId>/terminal.log}. */
public class LocalLogFeature implements Feature {

    private static final Logger logger = LoggerFactory.getLogger(LocalLogFeature.class);

    private final Path logDir;
    private FileLogConsumer consumer;

    public LocalLogFeature(Path logDir) {
        this.logDir = logDir;
    }

    @Override
    public void created(Task task) {
        var path = logDir.resolve(task.taskId())
                .resolve(String.valueOf(task.runId()))
                .resolve("terminal.log");
        try {
            consumer = new FileLogConsumer(path);
        } catch (IOException e) {
            throw new FeatureException("Cannot open task log " + path, e);
        }
        task.log().attach(consumer);
    }

    @Override
    public void killed(Task task) {
        if (consumer != null) {
            logger.info("Task {} run {} log written to {}", task.taskId(), task.runId(), consumer.path());
        }
    }

    Path path() {
        return consumer == null ? null : consumer.path();
    }
}
