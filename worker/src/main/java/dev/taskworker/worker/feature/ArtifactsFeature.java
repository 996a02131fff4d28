package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.PathNotFoundException;
import dev.taskworker.worker.log.TaskLogFormat;
import dev.taskworker.worker.task.Task;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies each declared artifact out of the stopped container as a tar archive. A path missing
 * from the container is the submitter's problem and only noted in the task log.
 */
public class ArtifactsFeature implements Feature {

    private final Path artifactDir;

    public ArtifactsFeature(Path artifactDir) {
        this.artifactDir = artifactDir;
    }

    @Override
    public void stopped(Task task) {
        var artifacts = task.payload().artifacts();
        if (artifacts.isEmpty()) {
            return;
        }
        var container = task.container()
                .orElseThrow(() -> new FeatureException("No container to extract artifacts from"));
        var targetDir = artifactDir.resolve(task.taskId()).resolve(String.valueOf(task.runId())).normalize();

        for (var artifact : artifacts.entrySet()) {
            var name = artifact.getKey();
            var sourcePath = artifact.getValue();
            var target = targetDir.resolve(name + ".tar").normalize();
            if (!target.startsWith(targetDir)) {
                throw new FeatureException("Artifact name " + name + " escapes " + targetDir);
            }
            try (var archive = container.archive(sourcePath)) {
                Files.createDirectories(targetDir);
                Files.copy(archive, target, StandardCopyOption.REPLACE_EXISTING);
                task.log().write(TaskLogFormat.line("Extracted artifact %s from %s", name, sourcePath));
            } catch (PathNotFoundException e) {
                task.log().write(TaskLogFormat.line("Artifact %s not found at %s", name, sourcePath));
            } catch (IOException e) {
                throw new FeatureException("Failed to store artifact " + name + " at " + target, e);
            }
        }
    }
}
