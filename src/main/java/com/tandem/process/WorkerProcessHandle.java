package com.tandem.process;

import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.WorkerType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Live state of one spawned worker process.
 *
 * <p>Owned by the {@link ProcessLifecycleManager} registry. Its monitor appends output
 * and records the exit; callers may only read it or cancel through the manager.
 * Output is append-only. The status leaves {@link HandleStatus#RUNNING} exactly once,
 * and that transition completes the handle's one-shot completion signal.
 */
public class WorkerProcessHandle {

    private final String agentTaskId;
    private final WorkerType workerType;
    private final String payload;
    private final String description;
    private final String parentSessionId;
    private final SpawnOptions options;
    private final Process process;
    private final Instant startTime;
    private final Clock clock;

    private final StringBuilder output = new StringBuilder();
    private int lineCount;

    private volatile HandleStatus status = HandleStatus.RUNNING;
    private volatile Instant endTime;
    private volatile Integer exitCode;

    private final CompletableFuture<WorkerProcessHandle> completion = new CompletableFuture<>();

    WorkerProcessHandle(String agentTaskId, WorkerType workerType, String payload,
                        SpawnOptions options, Process process, Clock clock) {
        this.agentTaskId = agentTaskId;
        this.workerType = workerType;
        this.payload = payload;
        this.description = options.description();
        this.parentSessionId = options.parentSessionId();
        this.options = options;
        this.process = process;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public String agentTaskId() { return agentTaskId; }
    public WorkerType workerType() { return workerType; }
    public String payload() { return payload; }
    public String description() { return description; }
    public String parentSessionId() { return parentSessionId; }
    public long pid() { return process.pid(); }
    public Instant startTime() { return startTime; }
    public HandleStatus status() { return status; }
    public Instant endTime() { return endTime; }
    public Integer exitCode() { return exitCode; }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    Process process() {
        return process;
    }

    SpawnOptions options() {
        return options;
    }

    /** Everything the worker has printed so far. */
    public synchronized String output() {
        return output.toString();
    }

    public synchronized int lineCount() {
        return lineCount;
    }

    /**
     * The last {@code lines} complete lines of output (fewer if not that many exist).
     */
    public synchronized List<String> tail(int lines) {
        if (lines <= 0 || output.length() == 0) {
            return List.of();
        }
        String[] all = output.toString().split("\n", -1);
        // Output always ends with a newline, so the final element is empty
        int end = all.length - 1;
        int start = Math.max(0, end - lines);
        var result = new ArrayList<String>(end - start);
        for (int i = start; i < end; i++) {
            result.add(all[i]);
        }
        return result;
    }

    /** Time since start on the manager's clock, frozen once the handle is terminal. */
    public Duration elapsed() {
        Instant end = endTime;
        return Duration.between(startTime, end != null ? end : clock.instant());
    }

    /**
     * A copy of the completion signal; completes with this handle when it becomes terminal.
     */
    public CompletableFuture<WorkerProcessHandle> onTerminal() {
        return completion.copy();
    }

    /**
     * Waits for a terminal status without holding any shared lock.
     *
     * @return true if the handle is terminal, false if the timeout elapsed first
     */
    public boolean awaitTerminal(Duration timeout) {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isTerminal();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion signal of " + agentTaskId + " failed", e.getCause());
        }
    }

    public WorkerProcessHandle awaitTerminal() {
        return completion.join();
    }

    // -- Transitions, called by the monitor and the manager --

    synchronized void appendLine(String line) {
        output.append(line).append('\n');
        lineCount++;
    }

    /**
     * Records the process exit. Zero means COMPLETED, anything else FAILED.
     * If the handle was already cancelled only the exit code is kept.
     *
     * @return true if this call moved the handle out of RUNNING
     */
    boolean recordExit(int code, Instant at) {
        synchronized (this) {
            if (status.isTerminal()) {
                if (exitCode == null) {
                    exitCode = code;
                }
                return false;
            }
            exitCode = code;
            endTime = at;
            status = code == 0 ? HandleStatus.COMPLETED : HandleStatus.FAILED;
        }
        completion.complete(this);
        return true;
    }

    /**
     * Marks the handle FAILED without a real exit code, e.g. when its monitor was interrupted.
     */
    boolean recordFailure(String reason, Instant at) {
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            output.append("[tandem] ").append(reason).append('\n');
            lineCount++;
            exitCode = -1;
            endTime = at;
            status = HandleStatus.FAILED;
        }
        completion.complete(this);
        return true;
    }

    /**
     * RUNNING -> CANCELLED.
     *
     * @return true if the handle was running
     */
    boolean recordCancel(Instant at) {
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            endTime = at;
            status = HandleStatus.CANCELLED;
        }
        completion.complete(this);
        return true;
    }

    @Override
    public String toString() {
        return "WorkerProcessHandle[" + agentTaskId + " " + workerType.tag() + " " + status + "]";
    }
}
