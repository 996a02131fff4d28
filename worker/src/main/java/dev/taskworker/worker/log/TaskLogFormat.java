package dev.taskworker.worker.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Line formats consumed by downstream log readers. Every line is tagged and CRLF-terminated. */
public final class TaskLogFormat {

    public static final String TAG = "[taskworker] ";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TaskLogFormat() {}

    public static String line(String format, Object... args) {
        return TAG + String.format(format, args) + "\r\n";
    }

    public static String header(String taskId, String workerId) {
        return line("taskId: %s, workerId: %s", taskId, workerId);
    }

    public static String footer(boolean success, int exitCode, Instant start, Instant finish) {
        var humanSuccess = success ? "Successful" : "Unsuccessful";
        var seconds = Duration.between(start, finish).toSeconds();
        return line("%s task run with exit code: %d completed in %d seconds",
                humanSuccess, exitCode, seconds);
    }

    public static String schemaErrors(String prefix, List<?> errors) {
        String rendered;
        try {
            rendered = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema errors are not serializable", e);
        }
        return line("%s format is invalid json schema errors:\n%s", prefix, rendered);
    }

    public static String timeout(int maxRunTimeSeconds) {
        return line("Task timeout after %d seconds. Force killing container.", maxRunTimeSeconds);
    }
}
