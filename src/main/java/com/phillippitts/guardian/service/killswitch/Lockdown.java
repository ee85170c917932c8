package com.phillippitts.guardian.service.killswitch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-boxed refusal to take automatic action. Expires purely on elapsed time.
 */
public class Lockdown {

    private static final Logger LOG = LogManager.getLogger(Lockdown.class);

    private final Duration duration;
    private Instant until;

    public Lockdown(Duration duration) {
        this.duration = Objects.requireNonNull(duration, "duration");
    }

    /**
     * Starts (or restarts) the lockdown at {@code now}.
     *
     * @return the instant at which the lockdown lifts
     */
    public Instant enter(Instant now, String reason) {
        until = now.plus(duration);
        LOG.error("LOCKDOWN entered ({}); automatic action suspended until {}", reason, until);
        return until;
    }

    /** True when a lockdown was entered and its duration has fully elapsed. */
    public boolean hasExpired(Instant now) {
        return until != null && !now.isBefore(until);
    }

    public void clear() {
        until = null;
    }

    public Optional<Instant> until() {
        return Optional.ofNullable(until);
    }
}
