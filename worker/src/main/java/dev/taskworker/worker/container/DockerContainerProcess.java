package dev.taskworker.worker.container;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Link;
import dev.taskworker.worker.log.TaskLog;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class DockerContainerProcess implements ContainerProcess {

    private static final Logger logger = LoggerFactory.getLogger(DockerContainerProcess.class);

    private final DockerContainerRuntime runtime;
    private final DockerClient docker;
    private final ContainerSpec spec;
    private final TaskLog output;
    private final AtomicBoolean killed = new AtomicBoolean();
    private final AtomicBoolean removed = new AtomicBoolean();

    private volatile String containerId;
    private volatile ResultCallback.Adapter<Frame> logStream;

    DockerContainerProcess(DockerContainerRuntime runtime, DockerClient docker,
                           ContainerSpec spec, TaskLog output) {
        this.runtime = runtime;
        this.docker = docker;
        this.spec = spec;
        this.output = output;
    }

    @Override
    public void start() {
        runtime.pull(spec.image());

        var hostConfig = HostConfig.newHostConfig();
        if (!spec.links().isEmpty()) {
            hostConfig.withLinks(spec.links().stream()
                    .map(link -> new Link(link.name(), link.alias()))
                    .toArray(Link[]::new));
        }

        try {
            var response = docker.createContainerCmd(spec.image())
                    .withCmd(spec.command())
                    .withEnv(spec.env())
                    .withTty(true)
                    .withAttachStdin(false)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withStdinOpen(false)
                    .withHostConfig(hostConfig)
                    .exec();
            containerId = response.getId();
            docker.startContainerCmd(containerId).exec();
            if (killed.get()) {
                // Killed while still being created.
                sendKill();
            }
        } catch (DockerException e) {
            throw new ContainerException("Failed to start container from " + spec.image(), e);
        }

        logStream = docker.logContainerCmd(containerId)
                .withFollowStream(true)
                .withStdOut(true)
                .withStdErr(true)
                .exec(new ContainerOutputCallback(containerId, output));
        logger.info("Started container {} from {}", containerId, spec.image());
    }

    @Override
    public int run() {
        if (containerId == null) {
            throw new IllegalStateException("Container was not started");
        }
        try {
            Integer status = docker.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback())
                    .awaitStatusCode();
            return status == null ? -1 : status;
        } catch (DockerException | DockerClientException e) {
            throw new ContainerException("Failed waiting on container " + containerId, e);
        }
    }

    @Override
    public void kill() {
        if (killed.compareAndSet(false, true) && containerId != null) {
            sendKill();
        }
    }

    private void sendKill() {
        try {
            docker.killContainerCmd(containerId).exec();
            logger.info("Killed container {}", containerId);
        } catch (NotFoundException | ConflictException e) {
            logger.warn("Container {} had already exited when killed", containerId);
        }
    }

    @Override
    public boolean killed() {
        return killed.get();
    }

    @Override
    public void awaitOutput(Duration timeout) {
        var stream = logStream;
        if (stream == null) {
            return;
        }
        try {
            if (!stream.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Output of container {} did not end within {}ms", containerId, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerException("Interrupted draining output of " + containerId, e);
        }
    }

    @Override
    public void remove() {
        if (containerId == null || !removed.compareAndSet(false, true)) {
            return;
        }
        var stream = logStream;
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException e) {
                logger.warn("Failed to close output stream of container {}", containerId, e);
            }
        }
        try {
            docker.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
            logger.info("Removed container {}", containerId);
        } catch (NotFoundException e) {
            logger.debug("Container {} already removed", containerId);
        } catch (DockerException e) {
            throw new ContainerException("Failed to remove container " + containerId, e);
        }
    }

    @Override
    public InputStream archive(String path) {
        if (containerId == null) {
            throw new IllegalStateException("Container was not started");
        }
        try {
            return docker.copyArchiveFromContainerCmd(containerId, path).exec();
        } catch (NotFoundException e) {
            throw new PathNotFoundException("No such path in container " + containerId + ": " + path, e);
        } catch (DockerException e) {
            throw new ContainerException("Failed to copy " + path + " from " + containerId, e);
        }
    }
}
