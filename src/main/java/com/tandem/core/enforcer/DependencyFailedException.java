package com.tandem.core.enforcer;

/**
 * A task can never run because one of its (possibly transitive) dependencies failed.
 */
public class DependencyFailedException extends SpawnValidationException {

    private final String failedDependency;

    public DependencyFailedException(String taskId, String failedDependency) {
        super(taskId, SpawnValidation.Rejection.DEPENDENCY_FAILED,
                "Task " + taskId + " cannot run: dependency " + failedDependency + " failed");
        this.failedDependency = failedDependency;
    }

    public String failedDependency() {
        return failedDependency;
    }
}
