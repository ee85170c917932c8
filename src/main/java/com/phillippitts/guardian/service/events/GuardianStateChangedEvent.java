package com.phillippitts.guardian.service.events;

import com.phillippitts.guardian.domain.GuardianState;

import java.time.Instant;

/**
 * Published by the control loop whenever the guardian state changes.
 */
public record GuardianStateChangedEvent(
        GuardianState from,
        GuardianState to,
        String reason,
        Instant at
) {
    public GuardianStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
