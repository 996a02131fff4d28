package dev.taskworker.worker.feature;

import static org.junit.jupiter.api.Assertions.*;

import dev.taskworker.worker.container.ContainerLink;
import dev.taskworker.worker.container.FakeContainerRuntime;
import dev.taskworker.worker.task.TestTasks;
import dev.taskworker.worker.timer.ManualTimerService;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ServiceLinksFeatureTest {

    private final FakeContainerRuntime runtime = new FakeContainerRuntime(new ManualTimerService(), new ArrayList<>());

    @Test
    void startsServicesAndLinksThemByAlias() {
        var task = TestTasks.task("""
                {"image": "alpine", "command": [], "maxRunTime": 5,
                 "services": [{"image": "postgres:16", "alias": "db"}, {"image": "redis:7", "alias": "cache"}]}
                """);
        var feature = new ServiceLinksFeature(runtime);

        var links = feature.link(task);

        assertEquals(List.of(
                new ContainerLink("task-task-1-0-db", "db"),
                new ContainerLink("task-task-1-0-cache", "cache")), links);
        assertEquals(List.of("task-task-1-0-db", "task-task-1-0-cache"), runtime.startedServices());
    }

    @Test
    void killedRemovesEveryStartedService() {
        var task = TestTasks.task("""
                {"image": "alpine", "command": [], "maxRunTime": 5,
                 "services": [{"image": "postgres:16", "alias": "db"}]}
                """);
        var feature = new ServiceLinksFeature(runtime);
        feature.link(task);

        feature.killed(task);
        feature.killed(task);

        assertEquals(List.of("id-task-task-1-0-db"), runtime.removedServices());
    }

    @Test
    void failedRemovalStillRemovesTheOtherServices() {
        var task = TestTasks.task("""
                {"image": "alpine", "command": [], "maxRunTime": 5,
                 "services": [{"image": "postgres:16", "alias": "db"}, {"image": "redis:7", "alias": "cache"},
                              {"image": "nats:2", "alias": "bus"}]}
                """);
        runtime.failRemovalOf("id-task-task-1-0-db", "id-task-task-1-0-cache");
        var feature = new ServiceLinksFeature(runtime);
        feature.link(task);

        var error = assertThrows(FeatureException.class, () -> feature.killed(task));

        assertEquals(List.of("id-task-task-1-0-bus"), runtime.removedServices());
        assertTrue(error.getMessage().contains("id-task-task-1-0-db"));
        assertEquals(1, error.getSuppressed().length);

        feature.killed(task);
        assertEquals(List.of("id-task-task-1-0-bus"), runtime.removedServices());
    }

    @Test
    void noServicesMeansNoLinks() {
        var feature = new ServiceLinksFeature(runtime);

        assertTrue(feature.link(TestTasks.task(TestTasks.VALID_PAYLOAD)).isEmpty());
        assertTrue(runtime.startedServices().isEmpty());
    }

    @Test
    void containerNamesAreSanitized() {
        var task = TestTasks.task(TestTasks.VALID_PAYLOAD);

        assertEquals("task-task-1-0-my_alias", ServiceLinksFeature.containerName(task, "my alias"));
    }
}
