package dev.taskworker.worker.schema;

public record SchemaError(String field, String message) {}
