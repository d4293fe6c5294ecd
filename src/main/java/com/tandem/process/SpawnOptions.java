package com.tandem.process;

import java.nio.file.Path;
import java.util.Map;

/**
 * Optional settings for a single spawn.
 *
 * @param description      short label shown in listings
 * @param parentSessionId  orchestration session that owns the spawn, or null for ad-hoc work
 * @param envVars          extra environment variables
 * @param workingDirectory directory to start in, or null for the launcher default
 */
public record SpawnOptions(
    String description,
    String parentSessionId,
    Map<String, String> envVars,
    Path workingDirectory
) {

    public SpawnOptions {
        description = description != null ? description : "";
        envVars = envVars != null ? Map.copyOf(envVars) : Map.of();
    }

    public static SpawnOptions defaults() {
        return new SpawnOptions("", null, Map.of(), null);
    }

    public static SpawnOptions forSession(String parentSessionId, String description) {
        return new SpawnOptions(description, parentSessionId, Map.of(), null);
    }

    public SpawnOptions withEnv(Map<String, String> env) {
        return new SpawnOptions(description, parentSessionId, env, workingDirectory);
    }
}
