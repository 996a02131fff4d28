package dev.taskworker.worker.container;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.core.DockerClientBuilder;
import dev.taskworker.worker.log.TaskLog;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger logger = LoggerFactory.getLogger(DockerContainerRuntime.class);
    private static final long PULL_TIMEOUT_SECONDS = 300;

    private final DockerClient docker;

    public DockerContainerRuntime() {
        this(DockerClientBuilder.getInstance().build());
    }

    public DockerContainerRuntime(DockerClient docker) {
        this.docker = docker;
    }

    @Override
    public ContainerProcess create(ContainerSpec spec, TaskLog output) {
        return new DockerContainerProcess(this, docker, spec, output);
    }

    @Override
    public String startService(String image, String name) {
        pull(image);
        try {
            var response = docker.createContainerCmd(image)
                    .withName(name)
                    .exec();
            docker.startContainerCmd(response.getId()).exec();
            logger.info("Started service container {} ({})", name, image);
            return response.getId();
        } catch (DockerException e) {
            throw new ContainerException("Failed to start service " + name + " from " + image, e);
        }
    }

    @Override
    public void removeService(String containerId) {
        try {
            docker.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
        } catch (NotFoundException e) {
            logger.debug("Service container {} already gone", containerId);
        } catch (DockerException e) {
            throw new ContainerException("Failed to remove service container " + containerId, e);
        }
    }

    void pull(String image) {
        try {
            docker.pullImageCmd(image)
                    .start()
                    .awaitCompletion(PULL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerException("Image pull interrupted: " + image, e);
        } catch (RuntimeException e) {
            throw new ContainerException("Failed to pull image: " + image, e);
        }
    }
}
