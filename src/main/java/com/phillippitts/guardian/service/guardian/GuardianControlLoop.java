package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.domain.BrownoutLevel;
import com.phillippitts.guardian.domain.GuardianState;
import com.phillippitts.guardian.domain.GuardianStatus;
import com.phillippitts.guardian.domain.KillOutcome;
import com.phillippitts.guardian.domain.SystemMetrics;
import com.phillippitts.guardian.service.brownout.BrownoutManager;
import com.phillippitts.guardian.service.events.GuardianStateChangedEvent;
import com.phillippitts.guardian.service.events.KillSequenceCompletedEvent;
import com.phillippitts.guardian.service.events.LockdownEnteredEvent;
import com.phillippitts.guardian.service.killswitch.GracefulKillSequence;
import com.phillippitts.guardian.service.killswitch.KillRateLimiter;
import com.phillippitts.guardian.service.killswitch.Lockdown;
import com.phillippitts.guardian.service.metrics.GuardianMetrics;
import com.phillippitts.guardian.service.metrics.MetricsCollector;
import com.phillippitts.guardian.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One tick of the guardian: collect, evaluate, act, publish.
 *
 * <p>The loop is the single writer of all guardian state (current state, hysteresis, kill ledger,
 * lockdown, brownout). Other threads only read the immutable {@link GuardianStatus} snapshot
 * published at the end of every tick. {@link #tick()} never throws; a failed tick is logged,
 * counted and the next one proceeds normally.
 *
 * <p>Not thread-safe for writers: {@link #tick()} must only be called from one thread at a time.
 */
public class GuardianControlLoop {

    private static final Logger LOG = LogManager.getLogger(GuardianControlLoop.class);
    private static final String MDC_TICK = "tick";

    private final GuardianProperties props;
    private final MetricsCollector collector;
    private final BrownoutManager brownout;
    private final GracefulKillSequence killSequence;
    private final GuardianMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final HysteresisTracker tracker;
    private final KillRateLimiter rateLimiter;
    private final Lockdown lockdown;
    private final MetricsHistory history;
    private final Instant startedAt;

    private GuardianState state = GuardianState.NORMAL;
    private GuardianState previousState = GuardianState.NORMAL;
    private Instant stateSince;
    private long tickCount;

    private final AtomicReference<GuardianStatus> status = new AtomicReference<>();
    private final AtomicReference<List<SystemMetrics>> recentMetrics = new AtomicReference<>(List.of());

    public GuardianControlLoop(GuardianProperties props,
                               MetricsCollector collector,
                               BrownoutManager brownout,
                               GracefulKillSequence killSequence,
                               GuardianMetrics metrics,
                               ApplicationEventPublisher publisher,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.brownout = Objects.requireNonNull(brownout, "brownout");
        this.killSequence = Objects.requireNonNull(killSequence, "killSequence");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.tracker = new HysteresisTracker(props);
        this.rateLimiter = new KillRateLimiter(props.getKillCooldownShort(), props.getKillCooldownLong(),
                props.getMaxKillsPerWindow());
        this.lockdown = new Lockdown(props.getLockdownDuration());
        this.history = new MetricsHistory(props.getHistorySize());
        this.startedAt = clock.instant();
        this.stateSince = startedAt;
        publishStatus(SystemMetrics.empty(startedAt), startedAt);
    }

    /**
     * Runs one evaluation cycle. Never throws.
     */
    public void tick() {
        tickCount++;
        ThreadContext.put(MDC_TICK, Long.toString(tickCount));
        try {
            SystemMetrics sample = collector.collect();
            history.add(sample);
            Instant now = clock.instant();

            if (state == GuardianState.LOCKDOWN) {
                handleLockdown(now);
            } else {
                evaluate(sample, now);
            }

            Instant end = clock.instant();
            publishStatus(sample, end);
            if (props.isMetricsLoggingEnabled()) {
                logMetricsLine(sample, end);
            }
        } catch (RuntimeException e) {
            metrics.incrementTickError();
            LOG.error("Guardian tick failed; continuing", e);
        } finally {
            ThreadContext.remove(MDC_TICK);
        }
    }

    /** Latest published snapshot. Safe to call from any thread. */
    public GuardianStatus currentStatus() {
        return status.get();
    }

    /** Recent samples, oldest first. Safe to call from any thread. */
    public List<SystemMetrics> recentMetrics() {
        return recentMetrics.get();
    }

    public GuardianState state() {
        return state;
    }

    private void evaluate(SystemMetrics sample, Instant now) {
        Observation obs = tracker.observe(sample, now);
        Transition transition = GuardianTransitions.decide(state, obs, props.isKillEnabled());
        boolean changed = transition.changesFrom(state);
        if (changed) {
            changeState(transition.target(), transition.reason());
        }
        for (SideEffect effect : transition.effects()) {
            execute(effect, changed);
        }
        if (!changed) {
            reconcileBrownout();
        }
    }

    private void execute(SideEffect effect, boolean entered) {
        switch (effect) {
            case ACTIVATE_BROWNOUT -> applyBrownout(BrownoutLevel.MODERATE);
            case ESCALATE_BROWNOUT -> applyBrownout(BrownoutLevel.HEAVY);
            case DEACTIVATE_BROWNOUT -> applyBrownout(BrownoutLevel.NONE);
            case RUN_EMERGENCY -> handleEmergency(entered);
            default -> throw new IllegalStateException("Unhandled side effect " + effect);
        }
    }

    private void handleEmergency(boolean entered) {
        if (!props.isKillEnabled()) {
            if (entered) {
                LOG.warn("EMERGENCY: kill sequence disabled (guardian.kill-enabled=false); holding until recovery");
            }
            return;
        }
        Instant now = clock.instant();
        Optional<KillRateLimiter.Rejection> rejection = rateLimiter.tryAcquire(now).rejectionReason();
        if (rejection.isPresent()) {
            String reason = rejection.get().tag();
            metrics.incrementKillRejected(reason);
            enterLockdown(now, "kill rejected: " + reason);
            return;
        }

        KillOutcome outcome = killSequence.execute();
        publisher.publishEvent(new KillSequenceCompletedEvent(outcome));
        Instant after = clock.instant();
        if (outcome.success()) {
            changeState(GuardianState.NORMAL, "backend replaced");
            applyBrownout(BrownoutLevel.NONE);
        } else {
            enterLockdown(after, "kill sequence failed at " + outcome.failedPhase());
        }
    }

    private void enterLockdown(Instant now, String reason) {
        Instant until = lockdown.enter(now, reason);
        changeState(GuardianState.LOCKDOWN, reason);
        publisher.publishEvent(new LockdownEnteredEvent(reason, now, until));
    }

    private void handleLockdown(Instant now) {
        if (lockdown.hasExpired(now)) {
            lockdown.clear();
            changeState(GuardianState.NORMAL, "lockdown expired");
            killSequence.releaseIntake();
            applyBrownout(BrownoutLevel.NONE);
        }
    }

    private void changeState(GuardianState target, String reason) {
        GuardianState from = state;
        Instant now = clock.instant();
        previousState = from;
        state = target;
        stateSince = now;
        tracker.reset();
        LOG.warn("State change {} -> {} ({})", from, target, reason);
        publisher.publishEvent(new GuardianStateChangedEvent(from, target, reason, now));
    }

    private void applyBrownout(BrownoutLevel level) {
        if (!props.isBrownoutEnabled()) {
            LOG.debug("Brownout actions disabled; skipping level {}", level);
            return;
        }
        if (level == BrownoutLevel.NONE) {
            brownout.deactivate();
        } else {
            brownout.activate(level);
        }
    }

    // Retry a brownout level that a previous tick failed to reach
    private void reconcileBrownout() {
        if (!props.isBrownoutEnabled()) {
            return;
        }
        BrownoutLevel required = requiredLevel(state);
        if (required == null) {
            return;
        }
        if (required == BrownoutLevel.NONE ? !brownout.needsRestore() : brownout.currentLevel() == required) {
            return;
        }
        LOG.info("Brownout level {} does not match state {}; retrying {}", brownout.currentLevel(), state, required);
        applyBrownout(required);
    }

    private static BrownoutLevel requiredLevel(GuardianState state) {
        return switch (state) {
            case NORMAL -> BrownoutLevel.NONE;
            case BROWNOUT -> BrownoutLevel.MODERATE;
            case DEGRADED -> BrownoutLevel.HEAVY;
            case EMERGENCY, LOCKDOWN -> null;
        };
    }

    private void publishStatus(SystemMetrics sample, Instant now) {
        status.set(new GuardianStatus(
                state,
                previousState,
                stateSince,
                TimeUtils.secondsBetween(stateSince, now),
                TimeUtils.secondsBetween(startedAt, now),
                sample.withStateFlags(state),
                brownout.getState(),
                killSequence.getStatus(),
                rateLimiter.countInWindow(now),
                state == GuardianState.LOCKDOWN ? lockdown.until().orElse(null) : null,
                now));
        recentMetrics.set(history.snapshot());
    }

    private void logMetricsLine(SystemMetrics m, Instant now) {
        LOG.info(String.format(Locale.ROOT,
                "metrics state=%s ram_pct=%.1f ram_gb=%.2f cpu_pct=%.1f disk_pct=%.1f temp_c=%s "
                        + "backend_pids=%s brownout=%s kills_in_window=%d",
                state, m.ramPct(), m.ramGb(), m.cpuPct(), m.diskPct(),
                m.tempC() == null ? "n/a" : String.format(Locale.ROOT, "%.1f", m.tempC()),
                m.backendPids(), brownout.currentLevel(), rateLimiter.countInWindow(now)));
    }
}
