package com.phillippitts.guardian.service.guardian;

/**
 * What one tick's sample means for the state machine, after hysteresis.
 *
 * @param hardTrigger a hard threshold was breached on this sample
 * @param hardReason human-readable description of the breach, or null
 * @param softSustained the soft trigger held for a full measurement window
 * @param recovered good samples have held for the whole recovery window
 */
public record Observation(
        boolean hardTrigger,
        String hardReason,
        boolean softSustained,
        boolean recovered
) {
}
