package com.phillippitts.guardian.domain;

/**
 * Operating state of the guardian control loop.
 *
 * <p>Exactly one state is active at any time. Only the control loop mutates it.
 *
 * <pre>
 * NORMAL → BROWNOUT → DEGRADED   (sustained soft trigger)
 * any    → EMERGENCY             (single-tick hard trigger)
 * EMERGENCY → NORMAL | LOCKDOWN  (kill sequence outcome / rate limit)
 * LOCKDOWN  → NORMAL             (lockdown duration elapsed)
 * </pre>
 */
public enum GuardianState {
    NORMAL,
    BROWNOUT,
    DEGRADED,
    EMERGENCY,
    LOCKDOWN;

    /** True when serving quality is reduced or the backend is being recovered. */
    public boolean isDegraded() {
        return this == DEGRADED || this == EMERGENCY || this == LOCKDOWN;
    }

    /** True when new requests are expected to be refused by the serving system. */
    public boolean isIntakeBlocked() {
        return this == EMERGENCY || this == LOCKDOWN;
    }

    public boolean isEmergencyMode() {
        return this == EMERGENCY || this == LOCKDOWN;
    }

    /**
     * States that leave through the recovery window rule. EMERGENCY only does so while the
     * kill sequence is switched off; otherwise it resolves through the kill outcome.
     */
    public boolean isRecoverable(boolean killEnabled) {
        return this == BROWNOUT || this == DEGRADED || (this == EMERGENCY && !killEnabled);
    }
}
