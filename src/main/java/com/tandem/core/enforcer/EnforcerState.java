package com.tandem.core.enforcer;

/**
 * Lifecycle of a {@link DelegationEnforcer}: it waits on one wave at a time until
 * every wave has been checked and advanced past.
 */
public enum EnforcerState {
    AWAITING_WAVE,
    ALL_WAVES_COMPLETE
}
