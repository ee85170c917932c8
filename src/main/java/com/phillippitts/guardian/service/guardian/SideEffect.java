package com.phillippitts.guardian.service.guardian;

/**
 * Actions the control loop performs after a transition is decided.
 */
public enum SideEffect {
    /** Apply MODERATE brownout. */
    ACTIVATE_BROWNOUT,
    /** Apply HEAVY brownout. */
    ESCALATE_BROWNOUT,
    /** Restore normal operation. */
    DEACTIVATE_BROWNOUT,
    /** Consult the rate limiter and run the kill sequence, or lock down. */
    RUN_EMERGENCY
}
