package com.tandem.dispatch.cli;

import com.tandem.core.engine.ExecutionReport;
import com.tandem.core.engine.GraphExecutor;
import com.tandem.core.events.EventBus;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.graph.TaskGraphException;
import com.tandem.core.graph.TaskPlanParseException;
import com.tandem.core.graph.TaskPlanReader;
import com.tandem.core.orchestration.OrchestrationService;
import com.tandem.core.orchestration.OrchestrationSession;
import com.tandem.process.TandemProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: tandem run &lt;plan.json&gt;
 * <p>
 * Runs every task of a plan on worker processes, one wave at a time, and prints the
 * outcome. Exits non-zero when a task failed or the run was halted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task plan")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Set<String> LIVE_EVENTS =
            Set.of("task.spawned", "task.failed", "wave.advanced", "wave.violation");

    @Parameters(index = "0", description = "Task plan JSON file")
    private Path planFile;

    @Option(names = {"--window-ms", "-w"}, description = "Parallel window in milliseconds (default: configured value)")
    private Long windowMs;

    @Option(names = "--lenient", description = "Log compliance violations instead of halting")
    private boolean lenient;

    @Option(names = "--show-output", description = "Print each worker's output")
    private boolean showOutput;

    private final TaskPlanReader planReader;
    private final OrchestrationService orchestrationService;
    private final GraphExecutor graphExecutor;
    private final TandemProperties properties;

    public RunCommand(TaskPlanReader planReader, OrchestrationService orchestrationService,
                      GraphExecutor graphExecutor, TandemProperties properties) {
        this.planReader = planReader;
        this.orchestrationService = orchestrationService;
        this.graphExecutor = graphExecutor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TaskGraph graph;
        try {
            graph = planReader.readGraph(planFile);
        } catch (TaskPlanParseException | TaskGraphException | IllegalArgumentException e) {
            ConsoleOutput.error("Invalid plan " + planFile + ": " + e.getMessage());
            return 1;
        }

        Duration window = windowMs != null ? Duration.ofMillis(windowMs) : properties.getParallelWindow();
        boolean strict = properties.isStrict() && !lenient;

        ExecutionReport report;
        try (OrchestrationSession session = orchestrationService.open(graph, window, strict);
             EventBus.Subscription live = orchestrationService.eventBus()
                     .subscribe(session.sessionId(), LIVE_EVENTS, ConsoleOutput::event)) {
            ConsoleOutput.info("Session " + session.sessionId() + ": " + graph.size() + " tasks in "
                    + graph.waveCount() + " waves");
            report = graphExecutor.execute(session, Map.of());
        } catch (RuntimeException e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return 1;
        }

        if (showOutput) {
            report.outputs().forEach((taskId, output) -> {
                ConsoleOutput.info("Output of " + taskId + ":");
                System.out.print(output);
            });
        }
        ConsoleOutput.report(report);
        return report.succeeded() ? 0 : 1;
    }
}
