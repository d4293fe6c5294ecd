package com.tandem.core.engine;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.TaskSpec;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.model.WorkerType;
import com.tandem.core.orchestration.OrchestrationService;
import com.tandem.core.orchestration.TaskDispatcher;
import com.tandem.process.CommandLineWorkerLauncher;
import com.tandem.process.ProcessLifecycleManager;
import com.tandem.process.TandemProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class GraphExecutorTest {

    private TandemProperties properties;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ProcessLifecycleManager manager;
    private OrchestrationService service;

    @BeforeEach
    void setUp() {
        properties = new TandemProperties();
        properties.getWorker().setCancelGraceSeconds(1);
        properties.getWorker().getRoutes().put(TandemProperties.DEFAULT_ROUTE,
                new TandemProperties.Route(List.of("sh", "-c", "{payload}"), Map.of()));
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        var metrics = new TandemMetrics(registry);
        manager = new ProcessLifecycleManager(new CommandLineWorkerLauncher(properties), properties, eventBus, metrics);
        service = new OrchestrationService(new TaskDispatcher(manager), properties, eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static TaskGraph researchDocsImplement() {
        return TaskGraph.of(
                TaskSpec.of("research", WorkerType.DEWEY, "echo research"),
                TaskSpec.of("docs", WorkerType.EXPLORE, "echo docs"),
                TaskSpec.of("implement", WorkerType.FRONTEND, "echo implement", "research", "docs"));
    }

    @Test
    @DisplayName("Runs every wave and reports success")
    void completesGraph() {
        var executor = new GraphExecutor(Duration.ofSeconds(10), eventBus, new TandemMetrics(registry));
        var events = new CopyOnWriteArrayList<TandemEvent>();
        eventBus.subscribeAll(events::add);

        ExecutionReport report;
        try (var session = service.open(researchDocsImplement())) {
            report = executor.execute(session, Map.of("implement", "echo custom payload"));
        }

        assertEquals(ExecutionReport.Outcome.COMPLETED, report.outcome());
        assertTrue(report.succeeded());
        assertEquals(2, report.wavesExecuted());
        assertEquals(3, report.count(TaskStatus.COMPLETED));
        assertEquals("custom payload\n", report.outputs().get("implement"));
        assertEquals("research\n", report.outputs().get("research"));
        assertEquals(2, report.compliance().size());
        assertTrue(report.compliance().stream().allMatch(c -> c.compliant()));
        assertNull(report.haltReason());

        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("session.completed")));
        assertEquals(1.0, registry.find("tandem.sessions.total").tag("status", "completed").counter().count());
    }

    @Test
    @DisplayName("A failed task fails its dependents and the run still finishes")
    void failureCascade() {
        var graph = TaskGraph.of(
                TaskSpec.of("research", WorkerType.DEWEY, "exit 4"),
                TaskSpec.of("docs", WorkerType.EXPLORE, "echo docs"),
                TaskSpec.of("implement", WorkerType.FRONTEND, "echo implement", "research", "docs"),
                TaskSpec.of("lint", WorkerType.EXPLORE, "echo lint", "docs"));
        var executor = new GraphExecutor(Duration.ofSeconds(10), eventBus, null);

        ExecutionReport report;
        try (var session = service.open(graph)) {
            report = executor.execute(session, Map.of());
        }

        assertEquals(ExecutionReport.Outcome.COMPLETED_WITH_FAILURES, report.outcome());
        assertEquals(TaskStatus.FAILED, report.taskStatuses().get("research"));
        assertEquals(TaskStatus.FAILED, report.taskStatuses().get("implement"));
        assertEquals(TaskStatus.COMPLETED, report.taskStatuses().get("lint"));
        assertFalse(report.outputs().containsKey("implement"));
    }

    @Test
    @DisplayName("Workers exceeding the output timeout are cancelled and count as failed")
    void timeoutCancels() {
        var graph = TaskGraph.of(
                TaskSpec.of("stuck", WorkerType.EXPLORE, "sleep 30"),
                TaskSpec.of("after", WorkerType.EXPLORE, "echo after", "stuck"));
        var executor = new GraphExecutor(Duration.ofMillis(300), eventBus, null);

        ExecutionReport report;
        try (var session = service.open(graph)) {
            report = executor.execute(session, Map.of());
        }

        assertEquals(ExecutionReport.Outcome.COMPLETED_WITH_FAILURES, report.outcome());
        assertEquals(TaskStatus.FAILED, report.taskStatuses().get("stuck"));
        assertEquals(TaskStatus.FAILED, report.taskStatuses().get("after"));
    }

    @Test
    @DisplayName("Empty graph completes immediately")
    void emptyGraph() {
        var executor = new GraphExecutor(Duration.ofSeconds(1), eventBus, null);
        try (var session = service.open(new TaskGraph(List.of()))) {
            var report = executor.execute(session, Map.of());
            assertEquals(ExecutionReport.Outcome.COMPLETED, report.outcome());
            assertEquals(0, report.wavesExecuted());
        }
    }
}
