package com.phillippitts.guardian.service.events;

import java.time.Instant;

/**
 * Published when automatic action is suspended. Lockdown requires operator attention.
 *
 * @param reason why lockdown was entered (kill failure phase or rate-limit rejection)
 * @param at when lockdown started
 * @param until when it lifts automatically
 */
public record LockdownEnteredEvent(String reason, Instant at, Instant until) {
}
