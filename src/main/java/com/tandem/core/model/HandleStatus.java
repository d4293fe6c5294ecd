package com.tandem.core.model;

/**
 * Status of a spawned worker process.
 */
public enum HandleStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
