package com.tandem.core.engine;

import com.tandem.core.enforcer.ComplianceResult;
import com.tandem.core.model.TaskStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running a task graph to the end (or until it was halted).
 *
 * @param sessionId     session that ran the graph
 * @param outcome       how the run ended
 * @param wavesExecuted number of waves the enforcer advanced past
 * @param taskStatuses  final status per task id, in declaration order
 * @param outputs       worker output per task id, for tasks that produced any
 * @param compliance    parallel-compliance result of every checked wave
 * @param haltReason    why the run stopped early, or null
 * @param elapsed       wall-clock duration of the run
 */
public record ExecutionReport(
    String sessionId,
    Outcome outcome,
    int wavesExecuted,
    Map<String, TaskStatus> taskStatuses,
    Map<String, String> outputs,
    List<ComplianceResult> compliance,
    String haltReason,
    Duration elapsed
) {

    public enum Outcome {
        /** Every task completed. */
        COMPLETED,
        /** All waves ran but at least one task failed. */
        COMPLETED_WITH_FAILURES,
        /** Stopped before the last wave, e.g. by a strict compliance violation. */
        HALTED
    }

    public ExecutionReport {
        taskStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(taskStatuses));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        compliance = List.copyOf(compliance);
    }

    public boolean succeeded() {
        return outcome == Outcome.COMPLETED;
    }

    public long count(TaskStatus status) {
        return taskStatuses.values().stream().filter(s -> s == status).count();
    }
}
