package com.tandem.core.enforcer;

import java.time.Duration;

/**
 * Result of checking whether one wave's spawns were issued close enough together.
 *
 * @param waveNumber   1-based wave number
 * @param compliant    whether the spread is within the window
 * @param spread       latest minus earliest spawn time among spawned tasks of the wave
 * @param window       the configured parallel window
 * @param spawnedTasks how many tasks of the wave had been spawned
 * @param detail       human-readable summary, naming spread and limit on violation
 */
public record ComplianceResult(
    int waveNumber,
    boolean compliant,
    Duration spread,
    Duration window,
    int spawnedTasks,
    String detail
) {}
