package com.phillippitts.guardian.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the brownout manager.
 *
 * @param active whether any degradation is currently applied
 * @param level applied level ({@link BrownoutLevel#NONE} when inactive)
 * @param activatedAt when the current level was applied, or null
 * @param duration time since activation, computed at read time
 * @param failedCalls outbound calls that failed since startup
 * @param primaryModel model restored on deactivation
 * @param fallbackModel model used while degraded
 * @param contextNormal context window restored on deactivation
 * @param contextReduced context window used from MODERATE upwards
 */
public record BrownoutState(
        boolean active,
        BrownoutLevel level,
        Instant activatedAt,
        Duration duration,
        long failedCalls,
        String primaryModel,
        String fallbackModel,
        int contextNormal,
        int contextReduced
) {
    public double durationSeconds() {
        return duration == null ? 0.0 : duration.toMillis() / 1000.0;
    }
}
