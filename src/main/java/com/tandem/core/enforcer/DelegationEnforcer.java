package com.tandem.core.enforcer;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.graph.Task;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gates spawning over one {@link TaskGraph} and checks that each wave was spawned in parallel.
 *
 * <p>The enforcer holds a cursor on the current wave. Only PENDING tasks of that wave whose
 * dependencies all COMPLETED may be spawned. Once every task of the wave is terminal,
 * the spread between its earliest and latest spawn is compared with the parallel window
 * and the cursor moves on. In strict mode a violation raises
 * {@link ParallelExecutionException} and the cursor stays put; in lenient mode the
 * violation is logged and recorded, and the wave advances anyway.
 *
 * <p>A failed task fails all of its PENDING dependents as well, so later waves
 * never wait on work that can no longer run.
 *
 * <p>One instance serves one orchestration session. Methods are thread-safe; the
 * internal lock covers only state mutation, never a process launch or a wait.
 */
public class DelegationEnforcer {

    private static final Logger log = LoggerFactory.getLogger(DelegationEnforcer.class);

    public static final Duration DEFAULT_PARALLEL_WINDOW = Duration.ofMillis(500);

    private final TaskGraph graph;
    private final Duration parallelWindow;
    private final boolean strict;
    private final String sessionId;
    private final EventBus eventBus;
    private final TandemMetrics metrics;
    private final Clock clock;

    private final Object lock = new Object();
    private int currentWaveIndex;
    private final Map<String, Instant> spawnLog = new LinkedHashMap<>();
    private final List<ComplianceResult> complianceHistory = new ArrayList<>();
    private final Map<String, DependencyFailedException> failureCauses = new ConcurrentHashMap<>();
    private final Set<String> reserved = new HashSet<>();

    public DelegationEnforcer(TaskGraph graph) {
        this(graph, DEFAULT_PARALLEL_WINDOW, true);
    }

    public DelegationEnforcer(TaskGraph graph, Duration parallelWindow, boolean strict) {
        this(graph, parallelWindow, strict, null, null, null, Clock.systemUTC());
    }

    /**
     * @param sessionId session the enforcer belongs to, used to tag events (nullable)
     * @param eventBus  where wave and task events are published (nullable)
     * @param metrics   compliance metrics sink (nullable)
     * @param clock     source of spawn timestamps when none is given explicitly
     */
    public DelegationEnforcer(TaskGraph graph, Duration parallelWindow, boolean strict, String sessionId,
                              EventBus eventBus, TandemMetrics metrics, Clock clock) {
        if (parallelWindow.isNegative()) {
            throw new IllegalArgumentException("Parallel window must not be negative: " + parallelWindow);
        }
        this.graph = graph;
        this.parallelWindow = parallelWindow;
        this.strict = strict;
        this.sessionId = sessionId;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public TaskGraph graph() { return graph; }
    public Duration parallelWindow() { return parallelWindow; }
    public boolean isStrict() { return strict; }
    public String sessionId() { return sessionId; }
    public Clock clock() { return clock; }

    /** Zero-based index of the wave being awaited; equals the wave count once complete. */
    public int currentWaveIndex() {
        synchronized (lock) {
            return currentWaveIndex;
        }
    }

    public EnforcerState state() {
        return isComplete() ? EnforcerState.ALL_WAVES_COMPLETE : EnforcerState.AWAITING_WAVE;
    }

    public boolean isComplete() {
        synchronized (lock) {
            return currentWaveIndex >= graph.waveCount();
        }
    }

    /** Every task of the current wave, whatever its status. */
    public List<Task> getCurrentWave() {
        return graph.getWaveTasks(currentWaveIndex());
    }

    /** Tasks of the current wave still waiting to be spawned. */
    public List<Task> getReadyTasks() {
        return graph.getReadyTasks(currentWaveIndex());
    }

    /**
     * Checks whether a task may be spawned now. Has no side effects.
     */
    public SpawnValidation validateSpawn(String taskId) {
        Optional<Task> found = graph.getTask(taskId);
        if (found.isEmpty()) {
            return SpawnValidation.rejected(SpawnValidation.Rejection.UNKNOWN_TASK,
                    "Unknown task: " + taskId);
        }
        Task task = found.get();

        var cause = failureCauses.get(taskId);
        if (cause != null) {
            return SpawnValidation.rejected(SpawnValidation.Rejection.DEPENDENCY_FAILED, cause.getMessage());
        }
        List<String> failed = graph.failedDependencies(taskId);
        if (!failed.isEmpty()) {
            return SpawnValidation.rejected(SpawnValidation.Rejection.DEPENDENCY_FAILED,
                    "Task " + taskId + " cannot run: dependency " + failed.get(0) + " failed");
        }
        List<String> unmet = graph.unmetDependencies(taskId);
        if (!unmet.isEmpty()) {
            return SpawnValidation.rejected(SpawnValidation.Rejection.UNMET_DEPENDENCIES,
                    "Task " + taskId + " has unmet dependencies: " + unmet);
        }

        synchronized (lock) {
            if (currentWaveIndex >= graph.waveCount()) {
                return SpawnValidation.rejected(SpawnValidation.Rejection.ALL_WAVES_COMPLETE,
                        "All waves are complete; task " + taskId + " is " + task.status());
            }
            int taskWave = graph.waveIndexOf(taskId);
            if (taskWave != currentWaveIndex) {
                return SpawnValidation.rejected(SpawnValidation.Rejection.NOT_CURRENT_WAVE,
                        "Task " + taskId + " belongs to wave " + (taskWave + 1)
                                + " but the current wave is " + (currentWaveIndex + 1));
            }
            if (task.status() != TaskStatus.PENDING) {
                return SpawnValidation.rejected(SpawnValidation.Rejection.ALREADY_SPAWNED,
                        "Task " + taskId + " was already spawned (status " + task.status() + ")");
            }
            if (reserved.contains(taskId)) {
                return SpawnValidation.rejected(SpawnValidation.Rejection.ALREADY_SPAWNED,
                        "Task " + taskId + " is already being spawned");
            }
        }
        return SpawnValidation.accepted();
    }

    /**
     * Validates the task and, if accepted, claims it so no other caller can spawn it
     * until the claim is settled by {@link #recordSpawn} or {@link #releaseSpawn}.
     * The process launch itself happens outside the lock, between the two calls.
     */
    public SpawnValidation reserveSpawn(String taskId) {
        synchronized (lock) {
            SpawnValidation validation = validateSpawn(taskId);
            if (validation.ok()) {
                reserved.add(taskId);
            }
            return validation;
        }
    }

    /** Drops a claim taken by {@link #reserveSpawn} when the launch failed. */
    public void releaseSpawn(String taskId) {
        synchronized (lock) {
            reserved.remove(taskId);
        }
    }

    public void recordSpawn(String taskId, String agentTaskId) {
        recordSpawn(taskId, agentTaskId, clock.instant());
    }

    /**
     * Records a successful spawn and links the task to its worker process.
     * Call only after {@link #validateSpawn} accepted the task and the process started.
     *
     * @throws IllegalStateException if the task is not PENDING
     */
    public void recordSpawn(String taskId, String agentTaskId, Instant timestamp) {
        synchronized (lock) {
            reserved.remove(taskId);
            graph.markSpawned(taskId, agentTaskId, timestamp);
            spawnLog.put(taskId, timestamp);
        }
        log.debug("Recorded spawn of {} as {} at {}", taskId, agentTaskId, timestamp);
        publish("task.spawned", taskId, Map.of("agentTaskId", agentTaskId, "spawnTime", timestamp.toString()));
    }

    /**
     * SPAWNED -> RUNNING once the worker process is confirmed alive.
     */
    public boolean markTaskRunning(String taskId) {
        return graph.markRunning(taskId);
    }

    /**
     * Compares the spawn spread of the current wave with the parallel window.
     *
     * @throws ParallelExecutionException in strict mode when the spread exceeds the window
     */
    public ComplianceResult checkParallelCompliance() {
        ComplianceResult result;
        synchronized (lock) {
            result = evaluateCompliance(currentWaveIndex);
        }
        if (!result.compliant()) {
            if (strict) {
                log.error(result.detail());
                throw new ParallelExecutionException(result);
            }
            log.warn(result.detail());
        }
        return result;
    }

    /**
     * Checks the current wave and moves the cursor to the next one.
     *
     * @throws WaveNotCompleteException   if a task of the current wave is not terminal
     * @throws ParallelExecutionException in strict mode when the wave was not spawned in parallel;
     *                                    the cursor does not move
     * @throws IllegalStateException      if all waves are already complete
     */
    public void advanceWave() {
        ComplianceResult result;
        int advancedFrom;
        int waveSize;
        boolean nowComplete;
        boolean halted;
        synchronized (lock) {
            if (currentWaveIndex >= graph.waveCount()) {
                throw new IllegalStateException("All " + graph.waveCount() + " waves are already complete");
            }
            var unfinished = graph.getWaveTasks(currentWaveIndex).stream()
                    .filter(t -> !t.status().isTerminal())
                    .map(Task::id)
                    .toList();
            if (!unfinished.isEmpty()) {
                throw new WaveNotCompleteException(currentWaveIndex + 1, unfinished);
            }

            result = evaluateCompliance(currentWaveIndex);
            // A halted wave is re-checked on every attempt; keep one entry per wave
            if (complianceHistory.isEmpty()
                    || complianceHistory.get(complianceHistory.size() - 1).waveNumber() != result.waveNumber()) {
                complianceHistory.add(result);
            }
            halted = !result.compliant() && strict;
            advancedFrom = currentWaveIndex;
            waveSize = graph.waves().get(currentWaveIndex).size();
            if (!halted) {
                currentWaveIndex++;
            }
            nowComplete = currentWaveIndex >= graph.waveCount();
        }

        if (halted) {
            reportViolation(result);
            throw new ParallelExecutionException(result);
        }

        if (!result.compliant()) {
            reportViolation(result);
        }
        if (metrics != null) {
            metrics.recordWaveSpread(result.spread().toMillis());
            metrics.recordWaveExecution(waveSize);
        }
        log.info("Wave {} of {} complete (spawn spread {}ms), {}", advancedFrom + 1, graph.waveCount(),
                result.spread().toMillis(), nowComplete ? "all waves complete" : "advancing to wave " + (advancedFrom + 2));
        publish("wave.advanced", null, Map.of(
                "completedWave", advancedFrom + 1,
                "spreadMs", result.spread().toMillis(),
                "compliant", result.compliant(),
                "allComplete", nowComplete));
    }

    /**
     * Advances past every leading wave whose tasks are all terminal.
     *
     * @return true if at least one wave was advanced
     * @throws ParallelExecutionException in strict mode, as {@link #advanceWave()}
     */
    public boolean advanceIfWaveComplete() {
        boolean advanced = false;
        while (true) {
            synchronized (lock) {
                if (currentWaveIndex >= graph.waveCount() || !graph.isWaveTerminal(currentWaveIndex)) {
                    return advanced;
                }
            }
            advanceWave();
            advanced = true;
        }
    }

    /**
     * Marks a task COMPLETED and advances the wave if that finished it.
     * Duplicate notifications are ignored.
     */
    public void markTaskCompleted(String taskId) {
        if (graph.markCompleted(taskId)) {
            publish("task.completed", taskId, Map.of());
        }
        advanceIfWaveComplete();
    }

    /**
     * Marks a task FAILED, fails its PENDING dependents with a {@link DependencyFailedException}
     * cause, and advances the wave if that finished it. Duplicate notifications are ignored.
     */
    public void markTaskFailed(String taskId) {
        if (graph.markFailed(taskId)) {
            publish("task.failed", taskId, Map.of());
            for (String dependent : graph.dependentsOf(taskId)) {
                var cause = new DependencyFailedException(dependent, taskId);
                if (graph.getTask(dependent).map(t -> t.status() == TaskStatus.PENDING).orElse(false)
                        && graph.markFailed(dependent)) {
                    failureCauses.put(dependent, cause);
                    log.warn(cause.getMessage());
                    publish("task.failed", dependent, Map.of("cause", "dependency", "failedDependency", taskId));
                }
            }
        }
        advanceIfWaveComplete();
    }

    /** Why a task was failed without running, if it was failed by a dependency. */
    public Optional<DependencyFailedException> getFailureCause(String taskId) {
        return Optional.ofNullable(failureCauses.get(taskId));
    }

    public Optional<Instant> getSpawnTime(String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(spawnLog.get(taskId));
        }
    }

    public Map<String, Instant> spawnLog() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(spawnLog));
        }
    }

    public List<ComplianceResult> complianceHistory() {
        synchronized (lock) {
            return List.copyOf(complianceHistory);
        }
    }

    public EnforcementStatus getEnforcementStatus() {
        synchronized (lock) {
            var statuses = new LinkedHashMap<String, TaskStatus>();
            graph.tasks().forEach(t -> statuses.put(t.id(), t.status()));
            List<String> waveTasks = currentWaveIndex < graph.waveCount()
                    ? List.copyOf(graph.waves().get(currentWaveIndex))
                    : List.of();
            return new EnforcementStatus(
                    currentWaveIndex + 1,
                    graph.waveCount(),
                    currentWaveIndex >= graph.waveCount() ? EnforcerState.ALL_WAVES_COMPLETE : EnforcerState.AWAITING_WAVE,
                    waveTasks,
                    Collections.unmodifiableMap(statuses),
                    List.copyOf(complianceHistory));
        }
    }

    // Caller holds the lock
    private ComplianceResult evaluateCompliance(int waveIndex) {
        int waveNumber = waveIndex + 1;
        if (waveIndex >= graph.waveCount()) {
            return new ComplianceResult(waveNumber, true, Duration.ZERO, parallelWindow, 0,
                    "No wave " + waveNumber + "; all waves complete");
        }
        var times = graph.waves().get(waveIndex).stream()
                .map(spawnLog::get)
                .filter(Objects::nonNull)
                .toList();
        if (graph.waves().get(waveIndex).size() < 2 || times.size() < 2) {
            return new ComplianceResult(waveNumber, true, Duration.ZERO, parallelWindow, times.size(),
                    "Wave " + waveNumber + " has fewer than two spawned tasks; nothing to run in parallel");
        }
        Instant earliest = Collections.min(times);
        Instant latest = Collections.max(times);
        Duration spread = Duration.between(earliest, latest);
        if (spread.compareTo(parallelWindow) > 0) {
            return new ComplianceResult(waveNumber, false, spread, parallelWindow, times.size(),
                    "Wave " + waveNumber + " tasks were not spawned in parallel: spawn spread "
                            + spread.toMillis() + "ms exceeds the " + parallelWindow.toMillis()
                            + "ms window. Issue every spawn of a wave before waiting on any of them.");
        }
        return new ComplianceResult(waveNumber, true, spread, parallelWindow, times.size(),
                "Wave " + waveNumber + " spawned within " + spread.toMillis() + "ms of "
                        + parallelWindow.toMillis() + "ms allowed");
    }

    private void reportViolation(ComplianceResult result) {
        if (strict) {
            log.error(result.detail());
        } else {
            log.warn("{} (lenient mode, advancing anyway)", result.detail());
        }
        if (metrics != null) {
            metrics.recordComplianceViolation(strict);
        }
        publish("wave.violation", null, Map.of(
                "wave", result.waveNumber(),
                "spreadMs", result.spread().toMillis(),
                "windowMs", result.window().toMillis(),
                "strict", strict));
    }

    private void publish(String eventType, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(TandemEvent.of(eventType, sessionId, taskId, payload));
        }
    }
}
