package com.phillippitts.guardian.service.killswitch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounds how often the kill sequence may run.
 *
 * <p>An attempt is rejected when the most recent kill is within the short cooldown, or when the
 * number of kills inside the long cooldown window has reached the cap. Accepted attempts are
 * recorded immediately, before the sequence runs, so a failing sequence still consumes budget.
 *
 * <p>Not thread-safe: owned by the control loop.
 */
public class KillRateLimiter {

    private static final Logger LOG = LogManager.getLogger(KillRateLimiter.class);

    /** Why an attempt was refused. */
    public enum Rejection {
        SHORT_COOLDOWN("short-cooldown"),
        WINDOW_CAP("window-cap");

        private final String tag;

        Rejection(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    /**
     * Result of {@link #tryAcquire(Instant)}.
     *
     * @param allowed whether the kill may run
     * @param rejection reason when not allowed, otherwise null
     */
    public record Decision(boolean allowed, Rejection rejection) {

        static Decision allow() {
            return new Decision(true, null);
        }

        static Decision reject(Rejection reason) {
            return new Decision(false, reason);
        }

        public Optional<Rejection> rejectionReason() {
            return Optional.ofNullable(rejection);
        }
    }

    private final Duration shortCooldown;
    private final Duration longWindow;
    private final int maxKillsPerWindow;

    // Oldest first
    private final Deque<Instant> ledger = new ArrayDeque<>();

    public KillRateLimiter(Duration shortCooldown, Duration longWindow, int maxKillsPerWindow) {
        this.shortCooldown = Objects.requireNonNull(shortCooldown, "shortCooldown");
        this.longWindow = Objects.requireNonNull(longWindow, "longWindow");
        if (maxKillsPerWindow < 1) {
            throw new IllegalArgumentException("maxKillsPerWindow must be >= 1");
        }
        this.maxKillsPerWindow = maxKillsPerWindow;
    }

    /**
     * Checks both limits and, when allowed, records the attempt at {@code now}.
     */
    public Decision tryAcquire(Instant now) {
        pruneOld(now);
        Instant last = ledger.peekLast();
        if (last != null && Duration.between(last, now).compareTo(shortCooldown) < 0) {
            LOG.warn("Kill rejected: last kill at {} is within the {}s cooldown",
                    last, shortCooldown.toSeconds());
            return Decision.reject(Rejection.SHORT_COOLDOWN);
        }
        if (ledger.size() >= maxKillsPerWindow) {
            LOG.warn("Kill rejected: {} kills already within {}s", ledger.size(), longWindow.toSeconds());
            return Decision.reject(Rejection.WINDOW_CAP);
        }
        ledger.addLast(now);
        LOG.info("Kill attempt recorded ({}/{} in window)", ledger.size(), maxKillsPerWindow);
        return Decision.allow();
    }

    /**
     * Number of recorded kills inside the long window ending at {@code now}.
     */
    public int countInWindow(Instant now) {
        pruneOld(now);
        return ledger.size();
    }

    private void pruneOld(Instant now) {
        Instant cutoff = now.minus(longWindow);
        while (!ledger.isEmpty() && !ledger.peekFirst().isAfter(cutoff)) {
            ledger.removeFirst();
        }
    }
}
