package com.tandem.core.graph;

/**
 * Thrown when a task plan document cannot be parsed into task specifications.
 */
public class TaskPlanParseException extends RuntimeException {
    public TaskPlanParseException(String message) {
        super(message);
    }

    public TaskPlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
