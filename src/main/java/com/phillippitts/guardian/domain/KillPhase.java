package com.phillippitts.guardian.domain;

/** Phases of the graceful kill sequence, in execution order. */
public enum KillPhase {
    STOP_INTAKE,
    TERMINATE,
    RESTART,
    HEALTH_GATE,
    RESUME_INTAKE
}
