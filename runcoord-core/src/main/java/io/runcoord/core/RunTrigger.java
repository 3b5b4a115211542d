package io.runcoord.core;

public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
