package dev.taskworker.worker.container;

public class PathNotFoundException extends ContainerException {

    public PathNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
