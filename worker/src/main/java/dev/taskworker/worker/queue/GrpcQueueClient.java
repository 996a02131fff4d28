package dev.taskworker.worker.queue;

import dev.taskworker.common.ClaimTaskRequest;
import dev.taskworker.common.PendingTask;
import dev.taskworker.common.PollTaskRequest;
import dev.taskworker.common.ReportCompletedRequest;
import dev.taskworker.common.TaskQueueGrpc;
import dev.taskworker.common.TaskQueueGrpc.TaskQueueBlockingStub;
import dev.taskworker.worker.lease.Claim;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GrpcQueueClient implements QueueClient, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GrpcQueueClient.class);

    private static final Set<Status.Code> RETRYABLE = EnumSet.of(
            Status.Code.UNAVAILABLE,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.RESOURCE_EXHAUSTED,
            Status.Code.ABORTED);

    private final ManagedChannel channel;
    private final TaskQueueBlockingStub stub;
    private final Duration callTimeout;

    public GrpcQueueClient(ManagedChannel channel, String token, Duration callTimeout) {
        this.channel = channel;
        var stub = TaskQueueGrpc.newBlockingStub(channel);
        if (token != null && !token.isBlank()) {
            stub = stub.withInterceptors(new BearerTokenInterceptor(token));
        }
        this.stub = stub;
        this.callTimeout = callTimeout;
    }

    public static GrpcQueueClient forTarget(String target, String token, Duration callTimeout) {
        var channel = ManagedChannelBuilder.forTarget(target)
                .usePlaintext()
                .build();
        return new GrpcQueueClient(channel, token, callTimeout);
    }

    @Override
    public Optional<QueuedTask> pollTask(String workerGroup, String workerId) {
        var request = PollTaskRequest.newBuilder()
                .setWorkerGroup(workerGroup)
                .setWorkerId(workerId)
                .build();
        var response = call("pollTask", () -> withDeadline().pollTask(request));
        if (!response.hasTask()) {
            return Optional.empty();
        }
        return Optional.of(toQueuedTask(response.getTask()));
    }

    @Override
    public Claim claimTask(String taskId, int runId, String workerId, String workerGroup) {
        var request = ClaimTaskRequest.newBuilder()
                .setTaskId(taskId)
                .setRunId(runId)
                .setWorkerId(workerId)
                .setWorkerGroup(workerGroup)
                .build();
        var response = call("claimTask", () -> withDeadline().claimTask(request));
        return new Claim(
                response.getWorkerId().isEmpty() ? workerId : response.getWorkerId(),
                response.getWorkerGroup().isEmpty() ? workerGroup : response.getWorkerGroup(),
                parseInstant("takenUntil", response.getTakenUntil()));
    }

    @Override
    public void reportCompleted(String taskId, int runId, boolean success) {
        var request = ReportCompletedRequest.newBuilder()
                .setTaskId(taskId)
                .setRunId(runId)
                .setSuccess(success)
                .build();
        call("reportCompleted", () -> withDeadline().reportCompleted(request));
    }

    @Override
    public void close() throws InterruptedException {
        channel.shutdown();
        if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
            logger.warn("Queue channel did not terminate in time, forcing shutdown");
            channel.shutdownNow();
        }
    }

    private TaskQueueBlockingStub withDeadline() {
        return stub.withDeadlineAfter(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static <T> T call(String rpc, Supplier<T> invocation) {
        try {
            return invocation.get();
        } catch (StatusRuntimeException e) {
            var code = e.getStatus().getCode();
            throw new QueueException(
                    rpc + " failed: " + code + (e.getStatus().getDescription() != null
                            ? " (" + e.getStatus().getDescription() + ")" : ""),
                    RETRYABLE.contains(code),
                    e);
        }
    }

    private static QueuedTask toQueuedTask(PendingTask task) {
        return new QueuedTask(
                task.getTaskId(),
                task.getRunId(),
                task.getPayloadJson(),
                task.getRetriesLeft(),
                task.getDeadline().isEmpty() ? null : parseInstant("deadline", task.getDeadline()));
    }

    private static Instant parseInstant(String field, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new QueueException("Queue returned a malformed " + field + ": " + value, false, e);
        }
    }
}
