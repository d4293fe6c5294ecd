package com.tandem.core.enforcer;

import java.util.List;

/**
 * Thrown when a wave is advanced while some of its tasks are not yet terminal.
 */
public class WaveNotCompleteException extends IllegalStateException {

    private final int waveNumber;
    private final List<String> unfinishedTasks;

    public WaveNotCompleteException(int waveNumber, List<String> unfinishedTasks) {
        super("Wave " + waveNumber + " cannot advance; tasks not yet terminal: " + unfinishedTasks);
        this.waveNumber = waveNumber;
        this.unfinishedTasks = List.copyOf(unfinishedTasks);
    }

    public int waveNumber() {
        return waveNumber;
    }

    public List<String> unfinishedTasks() {
        return unfinishedTasks;
    }
}
