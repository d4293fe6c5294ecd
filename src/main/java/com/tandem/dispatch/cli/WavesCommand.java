package com.tandem.dispatch.cli;

import com.tandem.core.graph.TaskGraph;
import com.tandem.core.graph.TaskGraphException;
import com.tandem.core.graph.TaskPlanParseException;
import com.tandem.core.graph.TaskPlanReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: tandem waves &lt;plan.json&gt;
 * <p>
 * Prints the wave partition of a task plan without spawning anything.
 */
@Command(name = "waves", mixinStandardHelpOptions = true, description = "Show the execution waves of a task plan")
@Component
public class WavesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task plan JSON file")
    private Path planFile;

    private final TaskPlanReader planReader;

    public WavesCommand(TaskPlanReader planReader) {
        this.planReader = planReader;
    }

    @Override
    public Integer call() {
        TaskGraph graph;
        try {
            graph = planReader.readGraph(planFile);
        } catch (TaskPlanParseException | TaskGraphException | IllegalArgumentException e) {
            ConsoleOutput.error("Invalid plan " + planFile + ": " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info(graph.size() + " tasks in " + graph.waveCount() + " waves");
        for (int i = 0; i < graph.waveCount(); i++) {
            ConsoleOutput.wave(i + 1, graph.waves().get(i));
            graph.getWaveTasks(i).forEach(t ->
                    ConsoleOutput.task(t.id(), t.workerType().tag(), t.description()));
        }
        return 0;
    }
}
