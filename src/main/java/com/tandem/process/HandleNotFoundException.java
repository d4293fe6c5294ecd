package com.tandem.process;

import java.util.NoSuchElementException;

/**
 * Thrown when an agent task id is not present in the process registry.
 */
public class HandleNotFoundException extends NoSuchElementException {

    private final String agentTaskId;

    public HandleNotFoundException(String agentTaskId) {
        super("No worker process registered as " + agentTaskId);
        this.agentTaskId = agentTaskId;
    }

    public String agentTaskId() {
        return agentTaskId;
    }
}
