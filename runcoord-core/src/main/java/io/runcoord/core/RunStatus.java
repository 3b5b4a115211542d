package io.runcoord.core;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
