package com.tandem.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task delegation and worker processes.
 */
@Service
public class TandemMetrics {

    private final MeterRegistry registry;

    public TandemMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(String workerType) {
        Counter.builder("tandem.worker.spawns")
                .tag("worker", workerType)
                .register(registry)
                .increment();
    }

    public void recordSpawnFailure(String workerType) {
        Counter.builder("tandem.worker.spawn_failures")
                .tag("worker", workerType)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome terminal handle status, lower case ("completed", "failed", "cancelled")
     */
    public void recordWorkerExecution(String workerType, String outcome, long ms) {
        Timer.builder("tandem.worker.duration")
                .tag("worker", workerType)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    // --- Parallel enforcement ---

    /**
     * Records the spread between the first and last spawn of a checked wave.
     */
    public void recordWaveSpread(long spreadMs) {
        DistributionSummary.builder("tandem.wave.spawn_spread_ms")
                .description("Spread between earliest and latest spawn within a wave")
                .baseUnit("milliseconds")
                .register(registry)
                .record(spreadMs);
    }

    /**
     * @param strict whether the violation was raised (strict) or only recorded
     */
    public void recordComplianceViolation(boolean strict) {
        Counter.builder("tandem.wave.compliance_violations")
                .description("Waves whose spawns were not issued in parallel")
                .tag("mode", strict ? "strict" : "lenient")
                .register(registry)
                .increment();
    }

    public void recordWaveExecution(int taskCount) {
        Counter.builder("tandem.wave.executions")
                .description("Waves advanced past")
                .register(registry)
                .increment();

        DistributionSummary.builder("tandem.wave.task_count")
                .description("Number of tasks per wave")
                .register(registry)
                .record(taskCount);
    }

    public void recordSessionResult(String status) {
        Counter.builder("tandem.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
