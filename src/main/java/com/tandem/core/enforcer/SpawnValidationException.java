package com.tandem.core.enforcer;

/**
 * Thrown when a task is not allowed to be spawned yet. Recoverable: the caller is
 * expected to check readiness again later, for example after a dependency completes.
 */
public class SpawnValidationException extends RuntimeException {

    private final String taskId;
    private final SpawnValidation.Rejection rejection;

    public SpawnValidationException(String taskId, SpawnValidation validation) {
        this(taskId, validation.rejection(), validation.reason());
    }

    protected SpawnValidationException(String taskId, SpawnValidation.Rejection rejection, String reason) {
        super(reason);
        this.taskId = taskId;
        this.rejection = rejection;
    }

    public String taskId() {
        return taskId;
    }

    public SpawnValidation.Rejection rejection() {
        return rejection;
    }
}
