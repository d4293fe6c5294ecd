package com.tandem.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declaration of one unit of work, as read from a task plan.
 *
 * @param id           unique key within the plan (e.g. "research")
 * @param workerType   which worker executes the task
 * @param description  free text, opaque to the scheduler
 * @param dependencies ids of tasks that must complete before this one may be spawned
 */
public record TaskSpec(
    String id,
    WorkerType workerType,
    String description,
    List<String> dependencies
) implements Serializable {

    public TaskSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (workerType == null) {
            throw new IllegalArgumentException("Task " + id + " has no worker type");
        }
        description = description != null ? description : "";
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public static TaskSpec of(String id, WorkerType workerType, String description, String... dependencies) {
        return new TaskSpec(id, workerType, description, List.of(dependencies));
    }
}
