package dev.taskworker.worker.feature;

import dev.taskworker.worker.container.ContainerRuntime;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

public final class StandardFeatures {

    public static final String SERVICES = "services";
    public static final String LOCAL_LOG = "localLog";
    public static final String ARTIFACTS = "artifacts";
    public static final String RUN_STATE = "runState";

    private StandardFeatures() {}

    /** Registration order is hook order: services link first, the local log attaches before artifacts. */
    public static FeatureRegistry registry(ContainerRuntime containers, Path logDir, Path artifactDir,
                                           Supplier<DynamoDbClient> dynamoDb, String runStateTable,
                                           String workerId, Clock clock) {
        return FeatureRegistry.builder()
                .register(SERVICES, true, () -> new ServiceLinksFeature(containers))
                .register(LOCAL_LOG, true, () -> new LocalLogFeature(logDir))
                .register(ARTIFACTS, true, () -> new ArtifactsFeature(artifactDir))
                .register(RUN_STATE, false,
                        () -> new RunStateFeature(dynamoDb.get(), runStateTable, workerId, clock))
                .build();
    }
}
