package com.tandem.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches workers as local OS processes using the command routes from {@link TandemProperties}.
 *
 * <p>Each launch:
 * <ul>
 *   <li>Resolves the route for the worker type (or the default route)</li>
 *   <li>Substitutes {@code {payload}}, {@code {workerType}} and {@code {agentTaskId}} in the command</li>
 *   <li>Adds the route's environment, then the request's environment, on top of the inherited one</li>
 *   <li>Merges stderr into stdout and closes stdin, so the worker never waits for input</li>
 * </ul>
 */
public class CommandLineWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(CommandLineWorkerLauncher.class);

    private final TandemProperties properties;

    public CommandLineWorkerLauncher(TandemProperties properties) {
        this.properties = properties;
    }

    @Override
    public Process launch(LaunchRequest request) {
        String tag = request.workerType().tag();
        TandemProperties.Route route = properties.getRoute(tag);
        if (route == null || route.getCommand() == null || route.getCommand().isEmpty()) {
            throw new SpawnException("No launch route configured for worker type " + tag);
        }

        List<String> command = buildCommand(route.getCommand(), request);
        var builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(route.getEnv());
        builder.environment().putAll(request.envVars());
        builder.environment().put("TANDEM_AGENT_TASK_ID", request.agentTaskId());
        builder.environment().put("TANDEM_WORKER_TYPE", tag);

        Path workingDir = resolveWorkingDirectory(request);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }

        log.info("Launching {} worker {}: {}", tag, request.agentTaskId(), command.get(0));
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException("Failed to launch " + tag + " worker " + request.agentTaskId()
                    + " (" + command.get(0) + "): " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", request.agentTaskId(), e.getMessage());
        }
        log.debug("Worker {} started with pid {}", request.agentTaskId(), process.pid());
        return process;
    }

    static List<String> buildCommand(List<String> template, LaunchRequest request) {
        var command = new ArrayList<String>(template.size());
        for (String arg : template) {
            command.add(arg
                    .replace("{payload}", request.payload() != null ? request.payload() : "")
                    .replace("{workerType}", request.workerType().tag())
                    .replace("{agentTaskId}", request.agentTaskId()));
        }
        return command;
    }

    private Path resolveWorkingDirectory(LaunchRequest request) {
        if (request.workingDirectory() != null) {
            return request.workingDirectory();
        }
        String configured = properties.getWorker().getWorkingDirectory();
        if (configured != null && !configured.isBlank()) {
            return new File(configured).toPath();
        }
        return null;
    }
}
