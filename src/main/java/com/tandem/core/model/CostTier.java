package com.tandem.core.model;

/**
 * Relative cost of running a worker type.
 */
public enum CostTier {
    CHEAP,
    MEDIUM,
    EXPENSIVE
}
