package dev.taskworker.worker.feature;

import dev.taskworker.worker.task.Task;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/** Records each run's state in a DynamoDB table: running once created, completed once stopped. */
public class RunStateFeature implements Feature {

    private static final Logger logger = LoggerFactory.getLogger(RunStateFeature.class);

    private final DynamoDbClient client;
    private final String tableName;
    private final String workerId;
    private final Clock clock;

    public RunStateFeature(DynamoDbClient client, String tableName, String workerId, Clock clock) {
        this.client = client;
        this.tableName = tableName;
        this.workerId = workerId;
        this.clock = clock;
    }

    @Override
    public void created(Task task) {
        put(task, toItem(task, Map.of("Running", AttributeValue.fromM(Map.of(
                "StartedAt", AttributeValue.fromS(clock.instant().toString()))))));
    }

    @Override
    public void stopped(Task task) {
        var exitCode = task.exitCode().orElse(-1);
        var killed = task.container().map(c -> c.killed()).orElse(false);
        put(task, toItem(task, Map.of("Completed", AttributeValue.fromM(Map.of(
                "ExitCode", AttributeValue.fromN(String.valueOf(exitCode)),
                "Killed", AttributeValue.fromBool(killed))))));
    }

    Map<String, AttributeValue> toItem(Task task, Map<String, AttributeValue> result) {
        var item = new HashMap<String, AttributeValue>();
        item.put("TaskId", AttributeValue.fromS(task.taskId()));
        item.put("RunId", AttributeValue.fromN(String.valueOf(task.runId())));
        item.put("WorkerId", AttributeValue.fromS(workerId));
        item.put("UpdatedAt", AttributeValue.fromN(String.valueOf(clock.instant().getEpochSecond())));
        item.put("Result", AttributeValue.fromM(result));
        return item;
    }

    private void put(Task task, Map<String, AttributeValue> item) {
        try {
            client.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(item)
                    .build());
        } catch (RuntimeException e) {
            throw new FeatureException("Failed to persist run state of task " + task.taskId(), e);
        }
        logger.debug("Persisted state for task {} run {}", task.taskId(), task.runId());
    }
}
