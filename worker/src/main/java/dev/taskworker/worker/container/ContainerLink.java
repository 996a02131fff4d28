package dev.taskworker.worker.container;

public record ContainerLink(String name, String alias) {

    /** Docker's {@code name:alias} link notation. */
    public String asDockerLink() {
        return name + ":" + alias;
    }
}
