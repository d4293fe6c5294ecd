package com.tandem.core.orchestration;

import com.tandem.core.enforcer.DelegationEnforcer;
import com.tandem.core.enforcer.EnforcementStatus;
import com.tandem.core.enforcer.SpawnValidationException;
import com.tandem.core.graph.Task;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.model.HandleStatus;
import com.tandem.process.ProcessLifecycleManager;
import com.tandem.process.SpawnException;
import com.tandem.process.SpawnOptions;
import com.tandem.process.WorkerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * One orchestration run over a task graph: the enforcer, the dispatcher it gates,
 * and the mapping from graph task ids to the workers spawned for them.
 *
 * <p>Worker outcomes are forwarded to the enforcer by {@link #awaitTask} on the calling
 * thread, so a strict-mode {@link com.tandem.core.enforcer.ParallelExecutionException}
 * raised by an automatic wave advance surfaces to the caller that observed the completion.
 *
 * <p>Closing the session cancels any of its workers that are still running.
 */
public class OrchestrationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationSession.class);

    private final String sessionId;
    private final DelegationEnforcer enforcer;
    private final TaskDispatcher dispatcher;
    private final Instant startedAt;
    private final Map<String, String> agentTaskIds = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public OrchestrationSession(String sessionId, DelegationEnforcer enforcer, TaskDispatcher dispatcher) {
        this.sessionId = sessionId;
        this.enforcer = enforcer;
        this.dispatcher = dispatcher;
        this.startedAt = enforcer.clock().instant();
    }

    public String sessionId() { return sessionId; }
    public DelegationEnforcer enforcer() { return enforcer; }
    public TaskGraph graph() { return enforcer.graph(); }
    public Instant startedAt() { return startedAt; }

    /**
     * Spawns one task of the current wave.
     *
     * @return the worker's agent task id
     * @throws SpawnValidationException if the task may not be spawned now
     * @throws SpawnException           if the worker process could not be started
     */
    public String spawn(String taskId, String payload) {
        ensureOpen();
        Task task = graph().getTask(taskId)
                .orElseThrow(() -> new SpawnValidationException(taskId, enforcer.validateSpawn(taskId)));
        String agentTaskId = dispatcher.spawnTask(taskId, task.workerType(), payload, enforcer,
                SpawnOptions.forSession(sessionId, taskId + ": " + task.description()));
        agentTaskIds.put(taskId, agentTaskId);
        return agentTaskId;
    }

    /**
     * Spawns every ready task of the current wave back to back, before waiting on any of them.
     * A task whose process cannot be started is marked failed; the rest of the wave is still spawned.
     *
     * @return agent task ids of the workers started, keyed by task id
     */
    public Map<String, String> spawnWave(Function<Task, String> payloadFor) {
        ensureOpen();
        var ready = enforcer.getReadyTasks();
        var payloads = new LinkedHashMap<String, String>();
        for (Task task : ready) {
            payloads.put(task.id(), payloadFor.apply(task));
        }

        var spawned = new LinkedHashMap<String, String>();
        var launchFailures = new ArrayList<String>();
        for (var entry : payloads.entrySet()) {
            try {
                spawned.put(entry.getKey(), spawn(entry.getKey(), entry.getValue()));
            } catch (SpawnException e) {
                log.error("Task {} could not be started: {}", entry.getKey(), e.getMessage());
                launchFailures.add(entry.getKey());
            }
        }
        // Failures are reported after the batch so they do not delay the remaining spawns
        launchFailures.forEach(enforcer::markTaskFailed);
        return spawned;
    }

    public Optional<String> agentTaskId(String taskId) {
        return Optional.ofNullable(agentTaskIds.get(taskId));
    }

    /** Task ids mapped to agent task ids, in spawn order. */
    public Map<String, String> agentTaskIds() {
        var ordered = new LinkedHashMap<String, String>();
        graph().tasks().stream()
                .filter(t -> agentTaskIds.containsKey(t.id()))
                .sorted(Comparator.comparing(Task::spawnTime, Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(t -> ordered.put(t.id(), agentTaskIds.get(t.id())));
        return ordered;
    }

    /**
     * Waits up to {@code timeout} for a task's worker and, if it finished, reports the
     * outcome to the enforcer. A cancelled worker counts as a failed task.
     *
     * @return the worker output; not terminal if the timeout elapsed first
     * @throws IllegalStateException if the task was never spawned in this session
     * @throws com.tandem.core.enforcer.ParallelExecutionException in strict mode, when this
     *         completion finished a wave that was not spawned in parallel
     */
    public WorkerOutput awaitTask(String taskId, Duration timeout) {
        String agentTaskId = agentTaskIds.get(taskId);
        if (agentTaskId == null) {
            throw new IllegalStateException("Task " + taskId + " has not been spawned in session " + sessionId);
        }
        WorkerOutput output = dispatcher.manager().getOutput(agentTaskId, true, timeout);
        if (output.isTerminal()) {
            forward(taskId, output.status());
        }
        return output;
    }

    /**
     * Waits for every spawned, unfinished task of the current wave. The timeout bounds
     * the whole wave, not each task.
     *
     * @return outputs keyed by task id
     */
    public Map<String, WorkerOutput> awaitWave(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        var outputs = new LinkedHashMap<String, WorkerOutput>();
        for (Task task : enforcer.getCurrentWave()) {
            if (agentTaskIds.containsKey(task.id()) && !task.status().isTerminal()) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                outputs.put(task.id(), awaitTask(task.id(), remaining));
            }
        }
        return outputs;
    }

    public EnforcementStatus status() {
        return enforcer.getEnforcementStatus();
    }

    public boolean isComplete() {
        return enforcer.isComplete();
    }

    /**
     * Cancels the worker spawned for a task. The task is marked failed once the
     * cancellation is observed through {@link #awaitTask}.
     *
     * @return true if a running worker was cancelled
     */
    public boolean cancelTask(String taskId) {
        String agentTaskId = agentTaskIds.get(taskId);
        return agentTaskId != null && dispatcher.manager().cancel(agentTaskId);
    }

    /**
     * Cancels this session's running workers.
     *
     * @return number of workers cancelled
     */
    public int cancelRunning() {
        int cancelled = 0;
        ProcessLifecycleManager manager = dispatcher.manager();
        for (var handle : manager.listHandles(sessionId)) {
            if (!handle.isTerminal() && manager.cancel(handle.agentTaskId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int cancelled = cancelRunning();
        if (cancelled > 0) {
            log.warn("Session {} closed with {} running worker(s); cancelled them", sessionId, cancelled);
        }
    }

    private void forward(String taskId, HandleStatus status) {
        if (status == HandleStatus.COMPLETED) {
            enforcer.markTaskCompleted(taskId);
        } else {
            enforcer.markTaskFailed(taskId);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
    }
}
