package com.tandem.core.graph;

/**
 * Thrown when a task plan cannot be turned into a valid task graph.
 */
public class TaskGraphException extends RuntimeException {
    public TaskGraphException(String message) {
        super(message);
    }
}
