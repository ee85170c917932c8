package com.phillippitts.guardian.domain;

import java.time.Instant;

/**
 * Immutable status snapshot published by the control loop after every tick.
 *
 * <p>Readers (HTTP status endpoint, actuator health) only ever see a complete snapshot;
 * the loop replaces it atomically.
 *
 * @param state current state
 * @param previousState state before the last transition
 * @param stateSince when the current state was entered
 * @param stateDurationSeconds seconds spent in the current state at snapshot time
 * @param uptimeSeconds seconds since the guardian started
 * @param metrics latest metrics snapshot with derived flags stamped
 * @param brownout brownout manager state
 * @param killSequence kill sequence status
 * @param killsInWindow kills recorded within the long rate-limit window
 * @param lockdownUntil lockdown expiry, or null when not locked down
 * @param generatedAt snapshot time
 */
public record GuardianStatus(
        GuardianState state,
        GuardianState previousState,
        Instant stateSince,
        double stateDurationSeconds,
        double uptimeSeconds,
        SystemMetrics metrics,
        BrownoutState brownout,
        KillSequenceStatus killSequence,
        int killsInWindow,
        Instant lockdownUntil,
        Instant generatedAt
) {
    public boolean requiresManualIntervention() {
        return state == GuardianState.LOCKDOWN;
    }
}
