package com.phillippitts.guardian.service.events;

import com.phillippitts.guardian.domain.GuardianState;
import com.phillippitts.guardian.domain.KillOutcome;
import com.phillippitts.guardian.service.metrics.GuardianMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records guardian events in metrics and logs operator-facing warnings, throttled to avoid log spam
 * when the guardian flaps between states.
 */
@Component
class GuardianEventsListener {
    private static final Logger LOG = LogManager.getLogger(GuardianEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final GuardianMetrics metrics;
    private final Clock clock;

    GuardianEventsListener(GuardianMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onStateChanged(GuardianStateChangedEvent e) {
        metrics.recordTransition(e.from(), e.to());
        if (e.to() == GuardianState.DEGRADED && shouldLog("degraded")) {
            LOG.warn("Guardian DEGRADED: heavy brownout applied. Serving capacity is reduced.");
        }
        if (e.from() != GuardianState.NORMAL && e.to() == GuardianState.NORMAL && shouldLog("recovered")) {
            LOG.info("Guardian back to NORMAL from {}", e.from());
        }
    }

    @EventListener
    void onKillSequenceCompleted(KillSequenceCompletedEvent e) {
        KillOutcome outcome = e.outcome();
        metrics.recordKillSequence(outcome.success(), outcome.elapsed());
        if (!outcome.success() && shouldLog("kill-failed-" + outcome.failedPhase())) {
            LOG.error("Backend replacement failed at phase {}. Check the backend host and launch command "
                    + "(guardian.kill-sequence.*).", outcome.failedPhase());
        }
    }

    @EventListener
    void onLockdown(LockdownEnteredEvent e) {
        if (shouldLog("lockdown")) {
            LOG.error("Guardian in LOCKDOWN until {} ({}). Manual intervention required.", e.until(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
