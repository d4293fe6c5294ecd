package com.tandem.core.engine;

import com.tandem.core.enforcer.ParallelExecutionException;
import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.graph.Task;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.orchestration.OrchestrationSession;
import com.tandem.process.TandemProperties;
import com.tandem.process.WorkerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a whole task graph through an {@link OrchestrationSession}, wave by wave.
 *
 * <p>For each wave every ready task is spawned in one batch, then each worker is awaited
 * and its outcome forwarded to the enforcer, which advances the wave once all of them
 * are terminal. Workers still running after the output timeout are cancelled and count
 * as failed. A strict compliance violation halts the run.
 */
@Service
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final Duration outputTimeout;
    private final EventBus eventBus;
    private final TandemMetrics metrics;

    @Autowired
    public GraphExecutor(TandemProperties properties, EventBus eventBus,
                         @Autowired(required = false) TandemMetrics metrics) {
        this(properties.getOutputTimeout(), eventBus, metrics);
    }

    GraphExecutor(Duration outputTimeout, EventBus eventBus, TandemMetrics metrics) {
        this.outputTimeout = outputTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes the session's graph. Tasks without an entry in {@code payloads} receive
     * their description as payload.
     */
    public ExecutionReport execute(OrchestrationSession session, Map<String, String> payloads) {
        var enforcer = session.enforcer();
        var outputs = new LinkedHashMap<String, String>();
        String haltReason = null;
        Instant start = Instant.now();

        MdcContext.setSession(session.sessionId());
        try {
            while (!enforcer.isComplete()) {
                int waveIndex = enforcer.currentWaveIndex();
                MdcContext.setWave(session.sessionId(), waveIndex + 1);

                var spawned = session.spawnWave(task -> payloadFor(task, payloads));
                log.info("Wave {}/{}: spawned {} task(s) {}", waveIndex + 1, session.graph().waveCount(),
                        spawned.size(), spawned.keySet());

                for (var entry : session.awaitWave(outputTimeout).entrySet()) {
                    outputs.put(entry.getKey(), entry.getValue().output());
                    if (!entry.getValue().isTerminal()) {
                        cancelOverdue(session, entry.getKey(), entry.getValue());
                    }
                }

                enforcer.advanceIfWaveComplete();
                if (!enforcer.isComplete() && enforcer.currentWaveIndex() == waveIndex) {
                    haltReason = "Wave " + (waveIndex + 1) + " made no progress; unfinished tasks: "
                            + enforcer.getCurrentWave().stream()
                                    .filter(t -> !t.status().isTerminal())
                                    .map(Task::id)
                                    .toList();
                    log.error(haltReason);
                    break;
                }
            }
        } catch (ParallelExecutionException e) {
            haltReason = e.getMessage();
            log.error("Session {} halted: {}", session.sessionId(), haltReason);
            session.cancelRunning();
        } finally {
            MdcContext.clear();
        }

        var report = buildReport(session, outputs, haltReason, Duration.between(start, Instant.now()));
        String status = report.outcome().name().toLowerCase(Locale.ROOT);
        if (metrics != null) {
            metrics.recordSessionResult(status);
        }
        var payload = new HashMap<String, Object>();
        payload.put("outcome", report.outcome().name());
        payload.put("wavesExecuted", report.wavesExecuted());
        payload.put("elapsedMs", report.elapsed().toMillis());
        eventBus.publish(TandemEvent.of("session.completed", session.sessionId(), null, payload));
        log.info("Session {} finished {} after {} wave(s) in {}ms", session.sessionId(), report.outcome(),
                report.wavesExecuted(), report.elapsed().toMillis());
        return report;
    }

    private void cancelOverdue(OrchestrationSession session, String taskId, WorkerOutput output) {
        log.warn("Task {} still running after {}s, cancelling {}", taskId, outputTimeout.toSeconds(),
                output.agentTaskId());
        session.cancelTask(taskId);
        // The handle is terminal either way now, so this returns at once and forwards the outcome
        session.awaitTask(taskId, Duration.ZERO);
    }

    private static String payloadFor(Task task, Map<String, String> payloads) {
        String payload = payloads.get(task.id());
        return payload != null ? payload : task.description();
    }

    private static ExecutionReport buildReport(OrchestrationSession session, Map<String, String> outputs,
                                               String haltReason, Duration elapsed) {
        var status = session.status();
        boolean anyFailed = status.taskStatuses().values().stream().anyMatch(s -> s == TaskStatus.FAILED);
        ExecutionReport.Outcome outcome;
        if (!session.isComplete()) {
            outcome = ExecutionReport.Outcome.HALTED;
        } else if (anyFailed) {
            outcome = ExecutionReport.Outcome.COMPLETED_WITH_FAILURES;
        } else {
            outcome = ExecutionReport.Outcome.COMPLETED;
        }
        int wavesExecuted = Math.min(status.currentWave() - 1, status.totalWaves());
        return new ExecutionReport(session.sessionId(), outcome, wavesExecuted, status.taskStatuses(),
                outputs, status.compliance(), haltReason, elapsed);
    }
}
