package com.tandem.core.model;

/**
 * Status of a declared task within a task graph.
 */
public enum TaskStatus {
    PENDING,
    SPAWNED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
