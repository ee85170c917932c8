package com.phillippitts.guardian.service.events;

import com.phillippitts.guardian.domain.KillOutcome;

/**
 * Published after every kill sequence run, successful or not.
 */
public record KillSequenceCompletedEvent(KillOutcome outcome) {
}
