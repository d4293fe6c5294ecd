package com.tandem.core.graph;

import com.tandem.core.model.TaskSpec;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.model.WorkerType;

import java.time.Instant;
import java.util.List;

/**
 * A declared task inside a {@link TaskGraph}.
 *
 * <p>Identity fields are fixed at construction. Status, the agent task id of the
 * spawned worker and the spawn time are changed only through the owning graph.
 * The agent task id is a lookup key into the process registry; the task never
 * owns the worker process.
 */
public final class Task {

    private final String id;
    private final WorkerType workerType;
    private final String description;
    private final List<String> dependencies;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile String agentTaskId;
    private volatile Instant spawnTime;

    Task(TaskSpec spec) {
        this.id = spec.id();
        this.workerType = spec.workerType();
        this.description = spec.description();
        this.dependencies = spec.dependencies();
    }

    public String id() { return id; }
    public WorkerType workerType() { return workerType; }
    public String description() { return description; }
    public List<String> dependencies() { return dependencies; }
    public TaskStatus status() { return status; }
    public String agentTaskId() { return agentTaskId; }
    public Instant spawnTime() { return spawnTime; }

    void setStatus(TaskStatus status) {
        this.status = status;
    }

    void recordSpawn(String agentTaskId, Instant spawnTime) {
        this.agentTaskId = agentTaskId;
        this.spawnTime = spawnTime;
        this.status = TaskStatus.SPAWNED;
    }

    @Override
    public String toString() {
        return "Task[" + id + " " + workerType.tag() + " " + status + "]";
    }
}
