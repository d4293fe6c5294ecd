package com.tandem.process;

import com.tandem.core.model.HandleStatus;

import java.time.Duration;

/**
 * Output of a worker as returned by {@link ProcessLifecycleManager#getOutput}.
 *
 * @param agentTaskId the handle this output belongs to
 * @param status      handle status at the time of the snapshot (may be non-terminal)
 * @param output      accumulated stdout/stderr
 * @param exitCode    process exit code, null while running or when cancelled before exit
 * @param elapsed     wall-clock time since the process started
 */
public record WorkerOutput(
    String agentTaskId,
    HandleStatus status,
    String output,
    Integer exitCode,
    Duration elapsed
) {

    static WorkerOutput of(WorkerProcessHandle handle) {
        // Status first: output read afterwards is never older than the status
        HandleStatus status = handle.status();
        return new WorkerOutput(handle.agentTaskId(), status, handle.output(), handle.exitCode(), handle.elapsed());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
