package com.tandem.core.graph;

/**
 * Thrown when a task depends on an id that is not declared in the same plan.
 */
public class UnknownDependencyException extends TaskGraphException {

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super("Task " + taskId + " depends on unknown task " + dependencyId);
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String taskId() {
        return taskId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
