package com.phillippitts.guardian.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable resource snapshot taken once per control-loop tick.
 *
 * <p>Percentages are in the range 0..100. {@code tempC} is null when no sensor is readable.
 * The derived flags are stamped by the control loop at the end of a tick via
 * {@link #withStateFlags(GuardianState)}; a freshly collected snapshot has all of them false.
 *
 * @param timestamp when the snapshot was taken
 * @param ramPct used memory as a percentage of total
 * @param ramGb used memory in GiB
 * @param cpuPct system CPU utilisation averaged over the sample interval
 * @param diskPct root filesystem usage
 * @param tempC best-effort CPU temperature in Celsius, or null
 * @param backendPids PIDs of processes matching the backend's serve invocation
 * @param degraded state was DEGRADED, EMERGENCY or LOCKDOWN
 * @param intakeBlocked state was EMERGENCY or LOCKDOWN
 * @param emergencyMode state was EMERGENCY or LOCKDOWN
 */
public record SystemMetrics(
        Instant timestamp,
        double ramPct,
        double ramGb,
        double cpuPct,
        double diskPct,
        Double tempC,
        List<Long> backendPids,
        boolean degraded,
        boolean intakeBlocked,
        boolean emergencyMode
) {
    public SystemMetrics {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        backendPids = backendPids == null ? List.of() : List.copyOf(backendPids);
    }

    /**
     * Creates a raw snapshot with all derived flags cleared.
     */
    public static SystemMetrics of(Instant timestamp, double ramPct, double ramGb, double cpuPct,
                                   double diskPct, Double tempC, List<Long> backendPids) {
        return new SystemMetrics(timestamp, ramPct, ramGb, cpuPct, diskPct, tempC, backendPids,
                false, false, false);
    }

    /**
     * Neutral snapshot used before the first tick completes.
     */
    public static SystemMetrics empty(Instant timestamp) {
        return of(timestamp, 0.0, 0.0, 0.0, 0.0, null, List.of());
    }

    public SystemMetrics withStateFlags(GuardianState state) {
        return new SystemMetrics(timestamp, ramPct, ramGb, cpuPct, diskPct, tempC, backendPids,
                state.isDegraded(), state.isIntakeBlocked(), state.isEmergencyMode());
    }
}
