package com.tandem.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Background monitor for one worker process.
 *
 * <p>Reads merged stdout/stderr line by line into the handle, then waits for the exit
 * code and records it. It holds no shared lock while blocked on the process and never
 * throws: every failure ends up as handle state.
 */
class ProcessMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ProcessMonitor.class);

    private final WorkerProcessHandle handle;
    private final Clock clock;

    ProcessMonitor(WorkerProcessHandle handle, Clock clock) {
        this.handle = handle;
        this.clock = clock;
    }

    @Override
    public void run() {
        Process process = handle.process();
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handle.appendLine(line);
            }
        } catch (IOException e) {
            // Stream closes abruptly when the process is killed; the exit code still tells the outcome
            log.debug("Output stream of {} closed: {}", handle.agentTaskId(), e.getMessage());
        }

        try {
            int exitCode = process.waitFor();
            if (handle.recordExit(exitCode, clock.instant())) {
                log.info("Worker {} exited with code {} after {}ms",
                        handle.agentTaskId(), exitCode, handle.elapsed().toMillis());
            } else {
                log.debug("Worker {} exited with code {} after reaching {}",
                        handle.agentTaskId(), exitCode, handle.status());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            handle.recordFailure("monitor interrupted before the worker exited", clock.instant());
            log.warn("Monitor for {} interrupted; worker terminated", handle.agentTaskId());
        }
    }
}
