package dev.taskworker.worker.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public interface PayloadValidator {

    /** Returns every violation found; an empty list means the payload is valid. */
    List<SchemaError> validate(JsonNode payload, String schemaId);
}
