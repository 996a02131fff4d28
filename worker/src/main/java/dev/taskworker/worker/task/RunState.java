package dev.taskworker.worker.task;

public enum RunState {
    IDLE,
    CLAIMED,
    LINKING,
    CREATED,
    VALIDATING,
    RUNNING,
    STOPPED_HOOKS,
    KILLED_HOOKS,
    REPORTED
}
