package dev.taskworker.worker;

import dev.taskworker.worker.container.DockerContainerRuntime;
import dev.taskworker.worker.feature.StandardFeatures;
import dev.taskworker.worker.lease.ReclaimPolicy;
import dev.taskworker.worker.queue.GrpcQueueClient;
import dev.taskworker.worker.schema.PayloadSchemaValidator;
import dev.taskworker.worker.stats.InMemoryStats;
import dev.taskworker.worker.task.Task;
import dev.taskworker.worker.task.TaskRunner;
import dev.taskworker.worker.task.WorkerRuntime;
import dev.taskworker.worker.timer.ScheduledTimerService;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Command(name = "taskworker", mixinStandardHelpOptions = true)
public class Main implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final String QUEUE_TOKEN_ENV = "QUEUE_TOKEN";

    @Option(names = "--queue", defaultValue = "${env:TASKWORKER_QUEUE:-localhost:9090}",
            description = "gRPC address of the task queue (default: ${DEFAULT-VALUE})")
    private String queueTarget;

    @Option(names = "--worker-id", defaultValue = "${env:TASKWORKER_WORKER_ID:-local}",
            description = "Identity reported when claiming tasks (default: ${DEFAULT-VALUE})")
    private String workerId;

    @Option(names = "--worker-group", defaultValue = "${env:TASKWORKER_WORKER_GROUP:-default}",
            description = "Worker group reported when claiming tasks (default: ${DEFAULT-VALUE})")
    private String workerGroup;

    @Option(names = "--capacity", defaultValue = "${env:TASKWORKER_CAPACITY:-1}",
            description = "Tasks run concurrently (default: ${DEFAULT-VALUE})")
    private int capacity;

    @Option(names = "--poll-interval", defaultValue = "${env:TASKWORKER_POLL_INTERVAL:-PT5S}",
            description = "ISO-8601 delay between queue polls (default: ${DEFAULT-VALUE})")
    private String pollInterval;

    @Option(names = "--log-dir", defaultValue = "${env:TASKWORKER_LOG_DIR:-logs}",
            description = "Directory task transcripts are written to (default: ${DEFAULT-VALUE})")
    private Path logDir;

    @Option(names = "--artifact-dir", defaultValue = "${env:TASKWORKER_ARTIFACT_DIR:-artifacts}",
            description = "Directory extracted artifacts are written to (default: ${DEFAULT-VALUE})")
    private Path artifactDir;

    @Option(names = "--reclaim-attempts", defaultValue = "${env:TASKWORKER_RECLAIM_ATTEMPTS:-3}",
            description = "Consecutive failed reclaims before a claim is given up (default: ${DEFAULT-VALUE})")
    private int reclaimAttempts;

    @Option(names = "--reclaim-backoff", defaultValue = "${env:TASKWORKER_RECLAIM_BACKOFF:-PT2S}",
            description = "ISO-8601 wait after the first failed reclaim, doubled per retry (default: ${DEFAULT-VALUE})")
    private String reclaimBackoff;

    @Option(names = "--run-state-table", defaultValue = "${env:TASKWORKER_RUN_STATE_TABLE:-TaskWorker-RunState}",
            description = "DynamoDB table used by the runState feature (default: ${DEFAULT-VALUE})")
    private String runStateTable;

    @Override
    public void run() {
        var config = toConfig();
        logger.info("Worker {} starting in group {}, queue={}, capacity={}",
                config.workerId(), config.workerGroup(), config.queueTarget(), config.capacity());
        if (config.queueToken() == null) {
            logger.info("Queue authorization disabled ({} is not set)", QUEUE_TOKEN_ENV);
        }

        var queue = GrpcQueueClient.forTarget(config.queueTarget(), config.queueToken(), Duration.ofSeconds(30));
        var containers = new DockerContainerRuntime();
        var stats = new InMemoryStats();
        var timers = new ScheduledTimerService(2);

        var registry = StandardFeatures.registry(
                containers, config.logDir(), config.artifactDir(), lazyDynamoDb(),
                config.runStateTable(), config.workerId(), timers.clock());
        var runner = new TaskRunner(new WorkerRuntime(
                config.workerId(),
                config.workerGroup(),
                queue,
                containers,
                new PayloadSchemaValidator(),
                stats,
                timers,
                config.reclaimPolicy(),
                Duration.ofSeconds(30)));
        var poller = new TaskPoller(queue, config,
                queued -> runner.claimAndRun(Task.create(queued, registry)));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down worker");
            try {
                poller.shutdown();
                queue.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            timers.close();
            stats.logSnapshot();
        }));

        poller.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    WorkerConfig toConfig() {
        var token = System.getenv(QUEUE_TOKEN_ENV);
        return new WorkerConfig(
                queueTarget,
                token == null || token.isBlank() ? null : token,
                workerId,
                workerGroup,
                capacity,
                Duration.parse(pollInterval),
                logDir,
                artifactDir,
                new ReclaimPolicy(reclaimAttempts, Duration.parse(reclaimBackoff)),
                runStateTable);
    }

    private static Supplier<DynamoDbClient> lazyDynamoDb() {
        return new Supplier<>() {
            private DynamoDbClient client;

            @Override
            public synchronized DynamoDbClient get() {
                if (client == null) {
                    client = DynamoDbClient.create();
                }
                return client;
            }
        };
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
