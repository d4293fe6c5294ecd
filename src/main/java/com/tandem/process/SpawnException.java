package com.tandem.process;

/**
 * Thrown when a worker process could not be started at all
 * (missing executable, permission denied, no route for the worker type).
 * Never retried by the lifecycle manager.
 */
public class SpawnException extends RuntimeException {
    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
