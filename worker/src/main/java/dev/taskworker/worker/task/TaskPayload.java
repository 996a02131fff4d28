package dev.taskworker.worker.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed view over the submitted payload. Reading is lenient: fields with the wrong shape are
 * skipped here and reported later by schema validation, since feature flags must be readable
 * before the payload has been validated.
 */
public record TaskPayload(
    String image,
    List<String> command,
    Map<String, String> env,
    int maxRunTime,
    Map<String, Boolean> features,
    Map<String, String> artifacts,
    List<ServiceSpec> services,
    JsonNode raw
) {

    private static final Logger logger = LoggerFactory.getLogger(TaskPayload.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static TaskPayload parse(String json) {
        try {
            return from(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            logger.warn("Task payload is not valid JSON: {}", e.getOriginalMessage());
            return from(NullNode.getInstance());
        }
    }

    public static TaskPayload from(JsonNode raw) {
        var image = text(raw.get("image"));

        var command = new ArrayList<String>();
        var commandNode = raw.get("command");
        if (commandNode != null && commandNode.isArray()) {
            commandNode.forEach(arg -> command.add(arg.asText()));
        }

        var env = new LinkedHashMap<String, String>();
        var envNode = raw.get("env");
        if (envNode != null && envNode.isObject()) {
            envNode.fields().forEachRemaining(e -> env.put(e.getKey(), e.getValue().asText()));
        }

        var maxRunTimeNode = raw.get("maxRunTime");
        int maxRunTime = maxRunTimeNode != null && maxRunTimeNode.isIntegralNumber()
                ? maxRunTimeNode.asInt() : 0;

        var features = new LinkedHashMap<String, Boolean>();
        var featuresNode = raw.get("features");
        if (featuresNode != null && featuresNode.isObject()) {
            featuresNode.fields().forEachRemaining(e -> {
                if (e.getValue().isBoolean()) {
                    features.put(e.getKey(), e.getValue().asBoolean());
                }
            });
        }

        var artifacts = new LinkedHashMap<String, String>();
        var artifactsNode = raw.get("artifacts");
        if (artifactsNode != null && artifactsNode.isObject()) {
            artifactsNode.fields().forEachRemaining(e -> {
                var path = text(e.getValue().get("path"));
                if (path != null) {
                    artifacts.put(e.getKey(), path);
                }
            });
        }

        var services = new ArrayList<ServiceSpec>();
        var servicesNode = raw.get("services");
        if (servicesNode != null && servicesNode.isArray()) {
            for (var service : servicesNode) {
                var serviceImage = text(service.get("image"));
                var alias = text(service.get("alias"));
                if (serviceImage != null && alias != null) {
                    services.add(new ServiceSpec(serviceImage, alias));
                }
            }
        }

        return new TaskPayload(
                image,
                Collections.unmodifiableList(command),
                Collections.unmodifiableMap(env),
                maxRunTime,
                Collections.unmodifiableMap(features),
                Collections.unmodifiableMap(artifacts),
                Collections.unmodifiableList(services),
                raw);
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
