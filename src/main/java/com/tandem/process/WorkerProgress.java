package com.tandem.process;

import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.WorkerType;

import java.time.Duration;
import java.util.List;

/**
 * Best-effort progress snapshot for polling.
 *
 * @param agentTaskId the handle
 * @param workerType  worker type of the handle
 * @param description label given at spawn
 * @param status      current status
 * @param recentLines last lines of output, oldest first
 * @param totalLines  number of output lines captured so far
 * @param elapsed     wall-clock time since start
 */
public record WorkerProgress(
    String agentTaskId,
    WorkerType workerType,
    String description,
    HandleStatus status,
    List<String> recentLines,
    int totalLines,
    Duration elapsed
) {}
