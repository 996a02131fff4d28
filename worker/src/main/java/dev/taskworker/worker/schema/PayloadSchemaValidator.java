package dev.taskworker.worker.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural validation of the worker payload, version 1.
 *
 * <p>Unlike a fail-fast check, every problem is collected so the submitter sees the whole list
 * in the task log at once.
 *
 * <pre>{@code
 * {
 *   "image": "alpine:3.19",
 *   "command": ["sh", "-c", "make test"],
 *   "maxRunTime": 600,
 *   "env": {"CI": "1"},
 *   "features": {"localLog": false},
 *   "artifacts": {"coverage": {"path": "/work/coverage"}},
 *   "services": [{"image": "postgres:16", "alias": "db"}]
 * }
 * }</pre>
 */
public class PayloadSchemaValidator implements PayloadValidator {

    public static final String PAYLOAD_SCHEMA = "https://schemas.taskworker.dev/worker/v1/payload.json#";

    private static final Pattern ARTIFACT_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    @Override
    public List<SchemaError> validate(JsonNode payload, String schemaId) {
        if (!PAYLOAD_SCHEMA.equals(schemaId)) {
            throw new IllegalArgumentException("Unknown payload schema: " + schemaId);
        }

        var errors = new ArrayList<SchemaError>();
        if (payload == null || !payload.isObject()) {
            errors.add(new SchemaError("", "payload must be an object"));
            return errors;
        }

        var image = payload.get("image");
        if (image == null || !image.isTextual() || image.asText().isBlank()) {
            errors.add(new SchemaError("image", "is required and must be a non-empty string"));
        }

        var command = payload.get("command");
        if (command == null || !command.isArray()) {
            errors.add(new SchemaError("command", "is required and must be an array of strings"));
        } else {
            for (int i = 0; i < command.size(); i++) {
                if (!command.get(i).isTextual()) {
                    errors.add(new SchemaError("command[" + i + "]", "must be a string"));
                }
            }
        }

        var maxRunTime = payload.get("maxRunTime");
        if (maxRunTime == null || !maxRunTime.canConvertToInt() || !maxRunTime.isIntegralNumber()) {
            errors.add(new SchemaError("maxRunTime", "is required and must be an integer"));
        } else if (maxRunTime.asInt() < 1) {
            errors.add(new SchemaError("maxRunTime", "must be at least 1"));
        }

        validateEnv(payload.get("env"), errors);
        validateFeatures(payload.get("features"), errors);
        validateArtifacts(payload.get("artifacts"), errors);
        validateServices(payload.get("services"), errors);
        return errors;
    }

    private static void validateEnv(JsonNode env, List<SchemaError> errors) {
        if (env == null) {
            return;
        }
        if (!env.isObject()) {
            errors.add(new SchemaError("env", "must be an object"));
            return;
        }
        for (var field : iterable(env.fields())) {
            if (!field.getValue().isTextual()) {
                errors.add(new SchemaError("env." + field.getKey(), "must be a string"));
            }
        }
    }

    private static void validateFeatures(JsonNode features, List<SchemaError> errors) {
        if (features == null) {
            return;
        }
        if (!features.isObject()) {
            errors.add(new SchemaError("features", "must be an object"));
            return;
        }
        for (var field : iterable(features.fields())) {
            if (!field.getValue().isBoolean()) {
                errors.add(new SchemaError("features." + field.getKey(), "must be a boolean"));
            }
        }
    }

    private static void validateArtifacts(JsonNode artifacts, List<SchemaError> errors) {
        if (artifacts == null) {
            return;
        }
        if (!artifacts.isObject()) {
            errors.add(new SchemaError("artifacts", "must be an object"));
            return;
        }
        for (var field : iterable(artifacts.fields())) {
            if (!isSafeArtifactName(field.getKey())) {
                errors.add(new SchemaError("artifacts." + field.getKey(),
                        "name must match [A-Za-z0-9_.-]+ and must not contain '..'"));
            }
            var path = field.getValue().get("path");
            if (path == null || !path.isTextual() || path.asText().isBlank()) {
                errors.add(new SchemaError(
                        "artifacts." + field.getKey() + ".path", "is required and must be a string"));
            }
        }
    }

    private static void validateServices(JsonNode services, List<SchemaError> errors) {
        if (services == null) {
            return;
        }
        if (!services.isArray()) {
            errors.add(new SchemaError("services", "must be an array"));
            return;
        }
        for (int i = 0; i < services.size(); i++) {
            var service = services.get(i);
            for (var key : List.of("image", "alias")) {
                var value = service.get(key);
                if (value == null || !value.isTextual() || value.asText().isBlank()) {
                    errors.add(new SchemaError(
                            "services[" + i + "]." + key, "is required and must be a string"));
                }
            }
        }
    }

    /** Artifact names become file names on the worker host. */
    static boolean isSafeArtifactName(String name) {
        return ARTIFACT_NAME.matcher(name).matches() && !name.contains("..");
    }

    private static <T> Iterable<T> iterable(Iterator<T> iterator) {
        return () -> iterator;
    }
}
