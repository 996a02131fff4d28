package dev.taskworker.worker.task;

public record ServiceSpec(String image, String alias) {}
