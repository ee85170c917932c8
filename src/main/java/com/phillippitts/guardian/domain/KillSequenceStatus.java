package com.phillippitts.guardian.domain;

import java.time.Instant;

/**
 * Status of the graceful kill sequence for reporting.
 *
 * @param lastExecution start time of the last successful sequence, or null
 * @param restartAttempts failed restart attempts since the last successful restart
 * @param maxAttempts configured restart attempt limit
 * @param lastOutcome outcome of the most recent run, or null if it never ran
 * @param pidFile path of the PID hint file
 * @param running true while a sequence is executing
 */
public record KillSequenceStatus(
        Instant lastExecution,
        int restartAttempts,
        int maxAttempts,
        KillOutcome lastOutcome,
        String pidFile,
        boolean running
) {
}
