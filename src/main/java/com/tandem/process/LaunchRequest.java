package com.tandem.process;

import com.tandem.core.model.WorkerType;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything needed to start one worker process.
 *
 * @param agentTaskId      id the process will be registered under
 * @param workerType       which worker to launch
 * @param payload          opaque input for the worker (prompt, file list, ...)
 * @param envVars          extra environment variables for this launch
 * @param workingDirectory directory to start in, or null for the launcher default
 */
public record LaunchRequest(
    String agentTaskId,
    WorkerType workerType,
    String payload,
    Map<String, String> envVars,
    Path workingDirectory
) {}
