package com.tandem.core.graph;

import java.util.List;

/**
 * Thrown when the declared dependencies form a cycle.
 */
public class CycleDetectedException extends TaskGraphException {

    private final List<String> cycle;

    /**
     * @param cycle task ids along the cycle, first id repeated at the end (e.g. [a, b, a])
     */
    public CycleDetectedException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
