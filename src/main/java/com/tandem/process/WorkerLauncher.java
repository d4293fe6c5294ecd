package com.tandem.process;

/**
 * Starts the OS process for a worker type.
 *
 * <p>This is the boundary to the routing table: implementations decide which
 * executable or endpoint serves a worker type. The lifecycle manager only needs a
 * started {@link Process} whose merged stdout/stderr it can read.
 * Implementations: {@link CommandLineWorkerLauncher}.
 */
public interface WorkerLauncher {

    /**
     * Launches the process and returns as soon as it has started.
     *
     * @throws SpawnException if the process could not be started
     */
    Process launch(LaunchRequest request);
}
