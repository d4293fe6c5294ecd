package com.tandem.core.enforcer;

/**
 * Outcome of {@link DelegationEnforcer#validateSpawn}.
 *
 * @param ok        whether the task may be spawned now
 * @param rejection why not, or null when ok
 * @param reason    human-readable explanation, or null when ok
 */
public record SpawnValidation(boolean ok, Rejection rejection, String reason) {

    public enum Rejection {
        UNKNOWN_TASK,
        ALL_WAVES_COMPLETE,
        DEPENDENCY_FAILED,
        UNMET_DEPENDENCIES,
        NOT_CURRENT_WAVE,
        ALREADY_SPAWNED
    }

    public static SpawnValidation accepted() {
        return new SpawnValidation(true, null, null);
    }

    public static SpawnValidation rejected(Rejection rejection, String reason) {
        return new SpawnValidation(false, rejection, reason);
    }
}
