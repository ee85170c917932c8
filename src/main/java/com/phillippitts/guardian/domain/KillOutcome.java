package com.phillippitts.guardian.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one run of the graceful kill sequence.
 *
 * @param success true when the backend was replaced and passed the health gate
 * @param failedPhase phase that aborted the sequence, or null on success
 * @param startedAt when the sequence began
 * @param elapsed total wall-clock time of the run
 * @param newPid PID of the relaunched backend, or null
 */
public record KillOutcome(
        boolean success,
        KillPhase failedPhase,
        Instant startedAt,
        Duration elapsed,
        Long newPid
) {
    public static KillOutcome succeeded(Instant startedAt, Duration elapsed, Long newPid) {
        return new KillOutcome(true, null, startedAt, elapsed, newPid);
    }

    public static KillOutcome failed(KillPhase phase, Instant startedAt, Duration elapsed) {
        return new KillOutcome(false, phase, startedAt, elapsed, null);
    }
}
