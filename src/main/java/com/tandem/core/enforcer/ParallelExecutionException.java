package com.tandem.core.enforcer;

import java.time.Duration;

/**
 * Raised in strict mode when independent tasks of a wave were spawned too far apart
 * to count as parallel. This is a fault in how the caller issues spawns, not a
 * worker failure: the fix is to issue the whole wave in one batch, not to retry.
 */
public class ParallelExecutionException extends RuntimeException {

    private final ComplianceResult result;

    public ParallelExecutionException(ComplianceResult result) {
        super(result.detail());
        this.result = result;
    }

    public ComplianceResult result() {
        return result;
    }

    public int waveNumber() {
        return result.waveNumber();
    }

    public Duration spread() {
        return result.spread();
    }

    public Duration window() {
        return result.window();
    }
}
