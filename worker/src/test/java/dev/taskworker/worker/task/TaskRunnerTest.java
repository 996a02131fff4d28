package dev.taskworker.worker.task;

import static org.junit.jupiter.api.Assertions.*;

import dev.taskworker.worker.container.ContainerException;
import dev.taskworker.worker.container.FakeContainerProcess;
import dev.taskworker.worker.container.FakeContainerRuntime;
import dev.taskworker.worker.feature.FeatureException;
import dev.taskworker.worker.feature.FeatureRegistry;
import dev.taskworker.worker.feature.RecordingFeature;
import dev.taskworker.worker.lease.LeaseException;
import dev.taskworker.worker.lease.ReclaimPolicy;
import dev.taskworker.worker.queue.QueueException;
import dev.taskworker.worker.queue.RecordingQueueClient;
import dev.taskworker.worker.schema.PayloadSchemaValidator;
import dev.taskworker.worker.stats.InMemoryStats;
import dev.taskworker.worker.timer.ManualTimerService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskRunnerTest {

    private List<String> events;
    private ManualTimerService timers;
    private RecordingQueueClient queue;
    private FakeContainerRuntime containers;
    private InMemoryStats stats;
    private TaskRunner runner;
    private StringBuilder transcript;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        timers = new ManualTimerService();
        queue = new RecordingQueueClient(timers.clock(), Duration.ofMinutes(10));
        containers = new FakeContainerRuntime(timers, events);
        stats = new InMemoryStats();
        transcript = new StringBuilder();
        runner = new TaskRunner(new WorkerRuntime(
                "worker-1", "group-a", queue, containers, new PayloadSchemaValidator(), stats, timers,
                ReclaimPolicy.DEFAULT, Duration.ofSeconds(5)));
    }

    private FeatureRegistry recording() {
        return FeatureRegistry.builder()
                .register("rec", true, () -> new RecordingFeature("rec", events))
                .build();
    }

    private Task task(String payload, FeatureRegistry registry) {
        var task = TestTasks.task(payload, registry);
        task.log().attach(transcript::append);
        return task;
    }

    @Test
    void successfulRunIsReportedWithTranscriptInOrder() {
        containers.configure(c -> c.exitsWith(0, Duration.ofSeconds(3)).prints("hi"));
        var task = task(TestTasks.VALID_PAYLOAD, recording());

        var outcome = runner.claimAndRun(task);

        assertTrue(outcome.success());
        assertEquals(0, outcome.exitCode());
        assertEquals(3, outcome.seconds());
        assertEquals(List.of(new RecordingQueueClient.Report("task-1", 0, true)), queue.reports());
        assertEquals(RunState.REPORTED, task.state());
        assertEquals("""
                [taskworker] taskId: task-1, workerId: worker-1\r
                hi\r
                [taskworker] Successful task run with exit code: 0 completed in 3 seconds\r
                """, transcript.toString());
        assertTrue(task.log().isEnded());
        assertEquals(0, stats.counter("tasks.timed_out"));
        assertEquals(0, containers.last().killCalls());
    }

    @Test
    void watchdogIsArmedForMaxRunTime() {
        runner.claimAndRun(task(TestTasks.VALID_PAYLOAD, recording()));

        assertTrue(timers.scheduled().stream().anyMatch(e -> e.delay().equals(Duration.ofMillis(10_000))));
    }

    @Test
    void hooksAndContainerStepsRunInLifecycleOrder() {
        runner.claimAndRun(task(TestTasks.VALID_PAYLOAD, recording()));

        assertEquals(List.of(
                "rec.link",
                "container.create",
                "rec.created",
                "container.start",
                "container.run",
                "container.awaitOutput",
                "rec.stopped",
                "container.remove",
                "rec.killed"), events);
    }

    @Test
    void injectsTaskIdentityIntoContainerEnvironment() {
        runner.claimAndRun(task("""
                {"image": "alpine", "command": [], "maxRunTime": 10, "env": {"RUN_ID": "spoofed", "A": "b"}}
                """, recording()));

        var env = containers.last().spec().env();
        assertTrue(env.contains("TASK_ID=task-1"));
        assertTrue(env.contains("RUN_ID=0"));
        assertTrue(env.contains("A=b"));
        assertFalse(env.contains("RUN_ID=spoofed"));
    }

    @Test
    void nonZeroExitIsReportedUnsuccessful() {
        containers.configure(c -> c.exitsWith(2, Duration.ofSeconds(1)));

        var outcome = runner.claimAndRun(task(TestTasks.VALID_PAYLOAD, recording()));

        assertFalse(outcome.success());
        assertEquals(List.of(new RecordingQueueClient.Report("task-1", 0, false)), queue.reports());
        assertTrue(transcript.toString().endsWith(
                "[taskworker] Unsuccessful task run with exit code: 2 completed in 1 seconds\r\n"));
    }

    @Test
    void invalidPayloadNeverStartsTheContainer() {
        var task = task("{\"image\": \"alpine\", \"maxRunTime\": 10}", recording());

        var outcome = runner.claimAndRun(task);

        var container = containers.last();
        assertFalse(container.started());
        assertEquals(0, container.runCalls());
        assertFalse(outcome.success());
        assertEquals(RunOutcome.INFRA_ERROR_EXIT_CODE, outcome.exitCode());
        assertEquals(List.of(new RecordingQueueClient.Report("task-1", 0, false)), queue.reports());

        var lines = transcript.toString();
        assertTrue(lines.startsWith("[taskworker] taskId: task-1, workerId: worker-1\r\n"));
        assertTrue(lines.contains("[taskworker] `task.payload` format is invalid json schema errors:\n"));
        assertTrue(lines.contains("command"));
        assertTrue(lines.endsWith(
                "[taskworker] Unsuccessful task run with exit code: -1 completed in 0 seconds\r\n"));
        assertEquals(1, container.removeCalls());
        assertEquals(List.of("rec.link", "container.create", "rec.created", "container.remove", "rec.killed"), events);
    }

    @Test
    void runPastMaxRunTimeIsKilledOnce() {
        containers.configure(c -> c.exitsWith(0, Duration.ofSeconds(60)));
        var task = task("""
                {"image": "alpine", "command": ["sleep", "60"], "maxRunTime": 5}
                """, recording());

        var outcome = runner.claimAndRun(task);

        assertEquals(1, containers.last().killCalls());
        assertEquals(FakeContainerProcess.KILLED_EXIT_CODE, outcome.exitCode());
        assertFalse(outcome.success());
        assertTrue(transcript.toString().contains(
                "[taskworker] Task timeout after 5 seconds. Force killing container.\r\n"));
        assertEquals(1, stats.counter("tasks.timed_out"));
        assertEquals(List.of(new RecordingQueueClient.Report("task-1", 0, false)), queue.reports());
    }

    @Test
    void finishingInTimeLeavesNoWatchdogOrReclaimBehind() {
        containers.configure(c -> c.exitsWith(0, Duration.ofSeconds(2)));

        runner.claimAndRun(task(TestTasks.VALID_PAYLOAD, recording()));
        timers.advance(Duration.ofHours(1));

        assertTrue(timers.pending().isEmpty());
        assertEquals(0, containers.last().killCalls());
        assertEquals(1, queue.claims());
    }

    @Test
    void longRunKeepsRenewingTheClaim() {
        containers.configure(c -> c.exitsWith(0, Duration.ofMinutes(20)));
        var task = task("""
                {"image": "alpine", "command": [], "maxRunTime": 3600}
                """, recording());

        var outcome = runner.claimAndRun(task);

        assertTrue(outcome.success());
        // 10 minute leases renewed every ~461s over a 1200s run.
        assertEquals(3, queue.claims());
        assertEquals(3, stats.counter("tasks.claims"));
    }

    @Test
    void failingHookAbortsWithoutReport() {
        var registry = FeatureRegistry.builder()
                .register("rec", true, () -> new RecordingFeature("rec", events).failingAt("stopped"))
                .build();
        var task = task(TestTasks.VALID_PAYLOAD, registry);

        var error = assertThrows(FeatureException.class, () -> runner.claimAndRun(task));

        assertTrue(error.getMessage().contains("rec"));
        assertTrue(queue.reports().isEmpty());
        assertEquals(1, containers.last().removeCalls());
        assertTrue(events.contains("rec.killed"));
        assertTrue(task.cancellation().isCancelled());
        assertTrue(task.log().isEnded());
        assertTrue(transcript.toString().contains("[taskworker] Task run aborted: "));
    }

    @Test
    void containerFailureAbortsWithoutReport() {
        containers.configure(c -> c.failsWith(new ContainerException("daemon went away", null)));
        var task = task(TestTasks.VALID_PAYLOAD, recording());

        assertThrows(ContainerException.class, () -> runner.claimAndRun(task));

        assertTrue(queue.reports().isEmpty());
        assertEquals(1, containers.last().removeCalls());
        assertTrue(timers.pending().isEmpty());
    }

    @Test
    void lostLeaseKillsContainerAndAbortsWithoutReport() {
        queue = new RecordingQueueClient(timers.clock(), Duration.ofSeconds(10));
        queue.failClaimsFrom(2);
        runner = new TaskRunner(new WorkerRuntime(
                "worker-1", "group-a", queue, containers, new PayloadSchemaValidator(), stats, timers,
                ReclaimPolicy.DEFAULT, Duration.ofSeconds(5)));
        containers.configure(c -> c.exitsWith(0, Duration.ofSeconds(60)));
        var task = task("""
                {"image": "alpine", "command": [], "maxRunTime": 120}
                """, recording());

        assertThrows(LeaseException.class, () -> runner.claimAndRun(task));

        assertEquals(1, containers.last().killCalls());
        assertTrue(queue.reports().isEmpty());
        assertTrue(transcript.toString().contains("[taskworker] Lost claim on task, aborting run\r\n"));
        assertEquals(0, stats.counter("tasks.timed_out"));
    }

    @Test
    void failedInitialClaimRunsNothing() {
        queue.failClaimsFrom(1);
        var task = task(TestTasks.VALID_PAYLOAD, recording());

        assertThrows(QueueException.class, () -> runner.claimAndRun(task));

        assertTrue(containers.created().isEmpty());
        assertTrue(events.isEmpty());
        assertEquals(RunState.IDLE, task.state());
        assertTrue(timers.pending().isEmpty());
    }

    @Test
    void recordsStateTimings() {
        runner.claimAndRun(task(TestTasks.VALID_PAYLOAD, recording()));

        for (var timer : List.of("tasks.time.claim", "tasks.time.states.linked", "tasks.time.states.created",
                "tasks.time.run", "tasks.time.states.stopped", "tasks.time.removed",
                "tasks.time.states.killed", "tasks.time.completed")) {
            assertEquals(1, stats.timerCount(timer), timer);
        }
    }
}
