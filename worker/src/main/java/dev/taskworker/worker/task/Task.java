package dev.taskworker.worker.task;

import dev.taskworker.worker.container.ContainerProcess;
import dev.taskworker.worker.feature.FeaturePipeline;
import dev.taskworker.worker.feature.FeatureRegistry;
import dev.taskworker.worker.lease.Claim;
import dev.taskworker.worker.log.TaskLog;
import dev.taskworker.worker.queue.QueuedTask;
import dev.taskworker.worker.timer.CancellationToken;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One run of a task, owned by the {@link TaskRunner} executing it. Besides the runner, only the
 * callbacks the runner registers (reclaim, deadline) touch this object.
 */
public class Task {

    private final TaskStatus status;
    private final int runId;
    private final TaskPayload payload;
    private final FeaturePipeline features;
    private final TaskLog log = new TaskLog();
    private final CancellationToken cancellation = new CancellationToken();

    private volatile RunState state = RunState.IDLE;
    private volatile Claim claim;
    private volatile ContainerProcess container;
    private volatile Integer exitCode;

    public Task(TaskStatus status, int runId, TaskPayload payload, FeaturePipeline features) {
        this.status = status;
        this.runId = runId;
        this.payload = payload;
        this.features = features;
    }

    public static Task create(QueuedTask queued, FeatureRegistry registry) {
        var payload = TaskPayload.parse(queued.payloadJson());
        return new Task(
                new TaskStatus(queued.taskId(), queued.retriesLeft(), queued.deadline()),
                queued.runId(),
                payload,
                FeaturePipeline.assemble(registry, payload.features()));
    }

    public String taskId() {
        return status.taskId();
    }

    public int runId() {
        return runId;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskPayload payload() {
        return payload;
    }

    public FeaturePipeline features() {
        return features;
    }

    public TaskLog log() {
        return log;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public RunState state() {
        return state;
    }

    public Claim claim() {
        return claim;
    }

    public Optional<ContainerProcess> container() {
        return Optional.ofNullable(container);
    }

    /** Exit code of the container, available from the {@code stopped} hooks on. */
    public OptionalInt exitCode() {
        var code = exitCode;
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    void advance(RunState next) {
        if (next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Task " + taskId() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void claim(Claim claim) {
        this.claim = claim;
    }

    void attach(ContainerProcess container) {
        this.container = container;
    }

    void exitCode(int exitCode) {
        this.exitCode = exitCode;
    }
}
