package dev.taskworker.worker.task;

import dev.taskworker.worker.container.ContainerProcess;
import dev.taskworker.worker.container.ContainerSpec;
import dev.taskworker.worker.lease.LeaseManager;
import dev.taskworker.worker.log.TaskLogFormat;
import dev.taskworker.worker.schema.PayloadSchemaValidator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one task from claim to completion report.
 *
 * <p>States advance in a fixed order: claimed, linking, created, validating, running, stopped
 * hooks, killed hooks, reported. An invalid payload skips from validating to the killed hooks and is
 * reported with exit code -1. Any other error stops the reclaim cadence and is rethrown without a
 * completion report so the lease lapses and the task can be retried.
 */
public class TaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);

    static final String PAYLOAD_PREFIX = "`task.payload`";

    private final WorkerRuntime runtime;

    public TaskRunner(WorkerRuntime runtime) {
        this.runtime = runtime;
    }

    public RunOutcome claimAndRun(Task task) {
        var lease = new LeaseManager(
                runtime.queue(), runtime.timers(), runtime.stats(), runtime.reclaimPolicy(),
                runtime.workerId(), runtime.workerGroup(), task.taskId(), task.runId());
        task.cancellation().register(lease);
        lease.onClaimed(task::claim);
        lease.onLeaseLost(lost -> {
            task.log().write(TaskLogFormat.line("Lost claim on task, aborting run"));
            task.container().ifPresent(ContainerProcess::kill);
        });

        try {
            lease.claim();
        } catch (RuntimeException e) {
            task.cancellation().cancel();
            throw e;
        }
        task.advance(RunState.CLAIMED);
        logger.info("Claimed task {} run {} until {}", task.taskId(), task.runId(), task.claim().takenUntil());

        RunOutcome outcome;
        try {
            outcome = run(task, lease);
            lease.throwIfLost();
        } catch (RuntimeException e) {
            task.cancellation().cancel();
            logger.error("Run {} of task {} aborted in state {}", task.runId(), task.taskId(), task.state(), e);
            cleanUp(task, e);
            throw e;
        }

        task.cancellation().cancel();
        runtime.stats().time("tasks.time.completed",
                () -> runtime.queue().reportCompleted(task.taskId(), task.runId(), outcome.success()));
        task.advance(RunState.REPORTED);
        logger.info("Task {} run {} reported {} (exit code {})", task.taskId(), task.runId(),
                outcome.success() ? "successful" : "unsuccessful", outcome.exitCode());
        return outcome;
    }

    RunOutcome run(Task task, LeaseManager lease) {
        var stats = runtime.stats();
        var clock = runtime.timers().clock();
        var log = task.log();
        var features = task.features();
        var startedAt = clock.instant();

        // Nothing reaches consumers until the created hooks had a chance to attach them.
        log.hold();
        log.write(TaskLogFormat.header(task.taskId(), runtime.workerId()));

        task.advance(RunState.LINKING);
        var links = stats.time("tasks.time.states.linked", () -> features.link(task));

        var injectedEnv = Map.of(
                "TASK_ID", task.taskId(),
                "RUN_ID", String.valueOf(task.runId()));
        var container = runtime.containers().create(
                ContainerSpec.configure(task.payload(), injectedEnv, links), log);
        task.attach(container);

        stats.time("tasks.time.states.created", () -> features.created(task));
        log.release();
        task.advance(RunState.CREATED);

        task.advance(RunState.VALIDATING);
        var errors = runtime.validator().validate(task.payload().raw(), PayloadSchemaValidator.PAYLOAD_SCHEMA);
        if (!errors.isEmpty()) {
            logger.info("Task {} has an invalid payload ({} error(s))", task.taskId(), errors.size());
            var outcome = new RunOutcome(false, RunOutcome.INFRA_ERROR_EXIT_CODE, startedAt, clock.instant());
            log.write(TaskLogFormat.schemaErrors(PAYLOAD_PREFIX, errors));
            log.write(TaskLogFormat.footer(false, outcome.exitCode(), startedAt, outcome.finishedAt()));
            log.end().join();
            // The container was configured and link peers started before validation.
            task.advance(RunState.KILLED_HOOKS);
            stats.time("tasks.time.removed", container::remove);
            stats.time("tasks.time.states.killed", () -> features.killed(task));
            return outcome;
        }

        lease.throwIfLost();
        task.advance(RunState.RUNNING);
        var watchdog = new DeadlineWatchdog(
                runtime.timers(), container, log, stats, task.payload().maxRunTime());
        task.cancellation().register(watchdog);
        watchdog.arm();

        int exitCode = stats.time("tasks.time.run", () -> {
            container.start();
            return container.run();
        });
        watchdog.disarm();
        container.awaitOutput(runtime.outputDrainTimeout());
        lease.throwIfLost();
        task.exitCode(exitCode);

        task.advance(RunState.STOPPED_HOOKS);
        stats.time("tasks.time.states.stopped", () -> features.stopped(task));
        var outcome = RunOutcome.of(exitCode, startedAt, clock.instant());
        log.write(TaskLogFormat.footer(outcome.success(), exitCode, startedAt, outcome.finishedAt()));
        log.end().join();

        task.advance(RunState.KILLED_HOOKS);
        stats.time("tasks.time.removed", container::remove);
        stats.time("tasks.time.states.killed", () -> features.killed(task));
        return outcome;
    }

    /** Best-effort teardown after an infrastructure error; secondary failures are suppressed. */
    private void cleanUp(Task task, RuntimeException error) {
        var log = task.log();
        if (!log.isEnded()) {
            try {
                log.write(TaskLogFormat.line("Task run aborted: %s", error.getMessage()));
                log.end().join();
            } catch (RuntimeException e) {
                error.addSuppressed(e);
            }
        }
        task.container().ifPresent(container -> {
            try {
                container.remove();
            } catch (RuntimeException e) {
                error.addSuppressed(e);
            }
        });
        if (task.state().ordinal() < RunState.KILLED_HOOKS.ordinal()) {
            try {
                task.features().killed(task);
            } catch (RuntimeException e) {
                error.addSuppressed(e);
            }
        }
    }
}
