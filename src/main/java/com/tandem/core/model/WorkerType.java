package com.tandem.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of worker types a task may be delegated to.
 *
 * <p>The scheduler never interprets a worker type; it only passes it to the
 * {@code WorkerLauncher}, whose routing table maps each type to a concrete executable.
 * The {@link #tag()} is the name used in task plans and configuration.
 */
public enum WorkerType {
    EXPLORE("explore", CostTier.CHEAP),
    DEWEY("dewey", CostTier.CHEAP),
    DOCUMENT_WRITER("document_writer", CostTier.CHEAP),
    MULTIMODAL("multimodal", CostTier.CHEAP),
    RESEARCH_LEAD("research-lead", CostTier.CHEAP),
    IMPLEMENTATION_LEAD("implementation-lead", CostTier.CHEAP),
    FRONTEND("frontend", CostTier.MEDIUM),
    DELPHI("delphi", CostTier.EXPENSIVE),
    PLANNER("planner", CostTier.EXPENSIVE),
    CODE_REVIEWER("code-reviewer", CostTier.EXPENSIVE),
    DEBUGGER("debugger", CostTier.EXPENSIVE),
    GENERAL("general", CostTier.EXPENSIVE);

    private final String tag;
    private final CostTier costTier;

    WorkerType(String tag, CostTier costTier) {
        this.tag = tag;
        this.costTier = costTier;
    }

    public String tag() {
        return tag;
    }

    public CostTier costTier() {
        return costTier;
    }

    /**
     * Resolves a worker type from its plan tag or enum name.
     * Matching ignores case and treats '-' and '_' as equivalent.
     *
     * @throws IllegalArgumentException if no worker type matches
     */
    public static WorkerType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Worker type must not be blank");
        }
        String normalized = normalize(tag);
        return Arrays.stream(values())
                .filter(t -> normalize(t.tag).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown worker type: " + tag
                        + ". Known types: " + Arrays.stream(values()).map(WorkerType::tag).toList()));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
