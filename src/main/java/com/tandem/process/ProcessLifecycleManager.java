package com.tandem.process;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.WorkerType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Spawns worker processes without blocking and tracks them until they are discarded.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Delegates process start-up to the {@link WorkerLauncher}</li>
 *   <li>Registers each {@link WorkerProcessHandle} by agent task id</li>
 *   <li>Runs one {@link ProcessMonitor} per handle to capture output and the exit code</li>
 *   <li>Serves blocking and non-blocking output retrieval, progress polling and cancellation</li>
 * </ul>
 *
 * <p>There is no bound on concurrent workers and no automatic timeout: a worker that
 * never exits runs until the caller cancels it. Handles stay registered until
 * {@link #discard} is called, since their output is kept nowhere else.
 */
@Service
public class ProcessLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ProcessLifecycleManager.class);
    private static final AtomicInteger MONITOR_COUNTER = new AtomicInteger(0);

    private final WorkerLauncher launcher;
    private final Duration cancelGracePeriod;
    private final EventBus eventBus;
    private final TandemMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, WorkerProcessHandle> registry = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<WorkerProcessHandle>> completionListeners =
            new CopyOnWriteArrayList<>();
    private final ExecutorService monitors = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "worker-monitor-" + MONITOR_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ProcessLifecycleManager(WorkerLauncher launcher, TandemProperties properties, EventBus eventBus,
                                   @Autowired(required = false) TandemMetrics metrics) {
        this(launcher, properties.getCancelGracePeriod(), eventBus, metrics, Clock.systemUTC());
    }

    ProcessLifecycleManager(WorkerLauncher launcher, Duration cancelGracePeriod) {
        this(launcher, cancelGracePeriod, new EventBus(), null, Clock.systemUTC());
    }

    ProcessLifecycleManager(WorkerLauncher launcher, Duration cancelGracePeriod, EventBus eventBus,
                            TandemMetrics metrics, Clock clock) {
        this.launcher = launcher;
        this.cancelGracePeriod = cancelGracePeriod;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WorkerProcessHandle spawn(WorkerType workerType, String payload) {
        return spawn(workerType, payload, SpawnOptions.defaults());
    }

    /**
     * Starts a worker and returns its handle as soon as the process is running.
     * Never waits for output.
     *
     * @throws SpawnException if the process could not be started
     */
    public WorkerProcessHandle spawn(WorkerType workerType, String payload, SpawnOptions options) {
        String agentTaskId = newAgentTaskId();
        var request = new LaunchRequest(agentTaskId, workerType, payload,
                options.envVars(), options.workingDirectory());

        Process process;
        try {
            process = launcher.launch(request);
        } catch (SpawnException e) {
            recordSpawnFailure(workerType, agentTaskId, e);
            throw e;
        } catch (RuntimeException e) {
            recordSpawnFailure(workerType, agentTaskId, e);
            throw new SpawnException("Failed to launch " + workerType.tag() + " worker: " + e.getMessage(), e);
        }

        var handle = new WorkerProcessHandle(agentTaskId, workerType, payload, options, process, clock);
        registry.put(agentTaskId, handle);
        handle.onTerminal().thenAccept(this::onTerminal);

        try {
            monitors.execute(new ProcessMonitor(handle, clock));
        } catch (RejectedExecutionException e) {
            registry.remove(agentTaskId);
            process.destroyForcibly();
            throw new SpawnException("Lifecycle manager is shut down; cannot monitor " + agentTaskId, e);
        }

        log.info("Spawned {} worker {} (pid {}){}", workerType.tag(), agentTaskId, handle.pid(),
                options.description().isBlank() ? "" : ": " + options.description());
        if (metrics != null) {
            metrics.recordSpawn(workerType.tag());
        }
        eventBus.publish(TandemEvent.of("worker.spawned", options.parentSessionId(), agentTaskId,
                Map.of("workerType", workerType.tag(), "pid", handle.pid())));
        return handle;
    }

    /**
     * Output accumulated so far. With {@code block}, waits for the handle to become
     * terminal first; the wait is on that handle's own completion signal only.
     */
    public WorkerOutput getOutput(String agentTaskId, boolean block) {
        var handle = require(agentTaskId);
        if (block) {
            handle.awaitTerminal();
        }
        return WorkerOutput.of(handle);
    }

    /**
     * Like {@link #getOutput(String, boolean)} but waits at most {@code timeout};
     * after a timeout the returned snapshot is still non-terminal.
     */
    public WorkerOutput getOutput(String agentTaskId, boolean block, Duration timeout) {
        var handle = require(agentTaskId);
        if (block && !handle.awaitTerminal(timeout)) {
            log.debug("Timed out after {}ms waiting for {}", timeout.toMillis(), agentTaskId);
        }
        return WorkerOutput.of(handle);
    }

    /**
     * Non-blocking snapshot of the last {@code tailLines} output lines and elapsed time.
     */
    public WorkerProgress getProgress(String agentTaskId, int tailLines) {
        var handle = require(agentTaskId);
        HandleStatus status = handle.status();
        return new WorkerProgress(agentTaskId, handle.workerType(), handle.description(), status,
                handle.tail(tailLines), handle.lineCount(), handle.elapsed());
    }

    /**
     * Requests termination of a running worker. The process tree receives a polite
     * termination signal first and is forcibly killed if still alive after the grace period.
     *
     * @return true if the handle moved to CANCELLED, false if it was already terminal
     */
    public boolean cancel(String agentTaskId) {
        var handle = require(agentTaskId);
        if (!handle.recordCancel(clock.instant())) {
            log.debug("Cancel of {} ignored: already {}", agentTaskId, handle.status());
            return false;
        }
        terminate(handle);
        return true;
    }

    /**
     * Cancels every running worker.
     *
     * @return number of workers cancelled
     */
    public int stopAll() {
        int stopped = 0;
        for (var handle : registry.values()) {
            if (!handle.isTerminal() && cancel(handle.agentTaskId())) {
                stopped++;
            }
        }
        if (stopped > 0) {
            log.info("Stopped {} running worker(s)", stopped);
        }
        return stopped;
    }

    /**
     * Spawns a terminal handle's worker type and payload again under a new agent task id.
     *
     * @throws IllegalStateException if the original is still running
     */
    public WorkerProcessHandle retry(String agentTaskId) {
        var original = require(agentTaskId);
        if (!original.isTerminal()) {
            throw new IllegalStateException("Worker " + agentTaskId + " is still running; cancel it before retrying");
        }
        var options = original.options();
        var retryOptions = new SpawnOptions("Retry of " + agentTaskId
                + (options.description().isBlank() ? "" : ": " + options.description()),
                options.parentSessionId(), options.envVars(), options.workingDirectory());
        log.info("Retrying {} worker {}", original.workerType().tag(), agentTaskId);
        return spawn(original.workerType(), original.payload(), retryOptions);
    }

    /**
     * Removes a terminal handle from the registry. Its output is gone afterwards.
     *
     * @return true if the handle was removed
     * @throws IllegalStateException if the handle is still running
     */
    public boolean discard(String agentTaskId) {
        var handle = require(agentTaskId);
        if (!handle.isTerminal()) {
            throw new IllegalStateException("Worker " + agentTaskId + " is still running; cannot discard");
        }
        return registry.remove(agentTaskId, handle);
    }

    public Optional<WorkerProcessHandle> getHandle(String agentTaskId) {
        return Optional.ofNullable(registry.get(agentTaskId));
    }

    /** All registered handles, oldest first. */
    public List<WorkerProcessHandle> listHandles() {
        return registry.values().stream()
                .sorted(Comparator.comparing(WorkerProcessHandle::startTime))
                .toList();
    }

    /** Handles spawned on behalf of one orchestration session, oldest first. */
    public List<WorkerProcessHandle> listHandles(String parentSessionId) {
        return listHandles().stream()
                .filter(h -> Objects.equals(parentSessionId, h.parentSessionId()))
                .toList();
    }

    /**
     * Registers a listener invoked once per handle when it becomes terminal,
     * on the thread that completed it.
     */
    public void addCompletionListener(Consumer<WorkerProcessHandle> listener) {
        completionListeners.add(listener);
    }

    public void removeCompletionListener(Consumer<WorkerProcessHandle> listener) {
        completionListeners.remove(listener);
    }

    @PreDestroy
    public void shutdown() {
        stopAll();
        monitors.shutdown();
    }

    private WorkerProcessHandle require(String agentTaskId) {
        var handle = registry.get(agentTaskId);
        if (handle == null) {
            throw new HandleNotFoundException(agentTaskId);
        }
        return handle;
    }

    private void terminate(WorkerProcessHandle handle) {
        Process process = handle.process();
        log.warn("Cancelling worker {} (pid {})", handle.agentTaskId(), handle.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .completeOnTimeout(process, cancelGracePeriod.toMillis(), TimeUnit.MILLISECONDS)
                .thenAccept(p -> {
                    if (p.isAlive()) {
                        log.warn("Worker {} ignored termination for {}s, killing it",
                                handle.agentTaskId(), cancelGracePeriod.toSeconds());
                        p.descendants().forEach(ProcessHandle::destroyForcibly);
                        p.destroyForcibly();
                    }
                });
    }

    private void onTerminal(WorkerProcessHandle handle) {
        String outcome = handle.status().name().toLowerCase(Locale.ROOT);
        if (metrics != null) {
            metrics.recordWorkerExecution(handle.workerType().tag(), outcome, handle.elapsed().toMillis());
        }
        var payload = new HashMap<String, Object>();
        payload.put("workerType", handle.workerType().tag());
        payload.put("status", handle.status().name());
        payload.put("elapsedMs", handle.elapsed().toMillis());
        if (handle.exitCode() != null) {
            payload.put("exitCode", handle.exitCode());
        }
        eventBus.publish(TandemEvent.of(
                handle.status() == HandleStatus.CANCELLED ? "worker.cancelled" : "worker.exited",
                handle.parentSessionId(), handle.agentTaskId(), payload));

        for (var listener : completionListeners) {
            try {
                listener.accept(handle);
            } catch (Exception e) {
                log.warn("Completion listener failed for {}: {}", handle.agentTaskId(), e.getMessage(), e);
            }
        }
    }

    private void recordSpawnFailure(WorkerType workerType, String agentTaskId, Exception e) {
        log.error("Could not spawn {} worker {}: {}", workerType.tag(), agentTaskId, e.getMessage());
        if (metrics != null) {
            metrics.recordSpawnFailure(workerType.tag());
        }
    }

    private static String newAgentTaskId() {
        return "agent_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
