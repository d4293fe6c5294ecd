package com.tandem.core.enforcer;

import com.tandem.core.model.TaskStatus;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of an enforcer, for status displays and debugging.
 *
 * @param currentWave      1-based number of the wave being awaited (waveCount + 1 once complete)
 * @param totalWaves       number of waves in the graph
 * @param state            enforcer lifecycle state
 * @param currentWaveTasks ids of the tasks in the current wave
 * @param taskStatuses     status of every task, in declaration order
 * @param compliance       compliance results of every wave checked so far
 */
public record EnforcementStatus(
    int currentWave,
    int totalWaves,
    EnforcerState state,
    List<String> currentWaveTasks,
    Map<String, TaskStatus> taskStatuses,
    List<ComplianceResult> compliance
) {}
