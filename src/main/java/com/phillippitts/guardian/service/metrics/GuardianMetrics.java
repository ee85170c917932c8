package com.phillippitts.guardian.service.metrics;

import com.phillippitts.guardian.domain.GuardianState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized Micrometer instrumentation for the guardian.
 *
 * <p>Provides:
 * <ul>
 *   <li>Current state as an ordinal gauge, plus one 0/1 gauge per state</li>
 *   <li>State transition counts by source and target</li>
 *   <li>Brownout call failures by action</li>
 *   <li>Kill attempts, outcomes, rejections and sequence duration</li>
 * </ul>
 *
 * <p>All meters are exposed at /actuator/prometheus.
 */
@Component
public class GuardianMetrics {

    private static final String METRIC_PREFIX = "guardian";

    private final MeterRegistry registry;
    private final AtomicInteger stateOrdinal = new AtomicInteger(GuardianState.NORMAL.ordinal());

    public GuardianMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".state", stateOrdinal, AtomicInteger::get)
                .description("Current guardian state ordinal (NORMAL=0 .. LOCKDOWN=4)")
                .register(registry);
        for (GuardianState state : GuardianState.values()) {
            Gauge.builder(METRIC_PREFIX + ".state.active", stateOrdinal,
                            v -> v.get() == state.ordinal() ? 1.0 : 0.0)
                    .description("1 when the guardian is in the tagged state")
                    .tag("state", state.name())
                    .register(registry);
        }
    }

    /**
     * Records a state transition and updates the state gauges.
     */
    public void recordTransition(GuardianState from, GuardianState to) {
        stateOrdinal.set(to.ordinal());
        Counter.builder(METRIC_PREFIX + ".transitions")
                .description("Number of guardian state transitions")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    /**
     * Increments the brownout call failure counter.
     *
     * @param action serving action that failed (switch-model, disable-tools, ...)
     */
    public void incrementBrownoutFailure(String action) {
        Counter.builder(METRIC_PREFIX + ".brownout.failures")
                .description("Number of failed brownout calls to the serving system")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    /**
     * Records a completed kill sequence.
     *
     * @param success whether the backend was replaced and healthy
     * @param elapsed wall-clock duration of the sequence
     */
    public void recordKillSequence(boolean success, Duration elapsed) {
        Counter.builder(METRIC_PREFIX + ".kills")
                .description("Number of kill sequences executed")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".kill.duration")
                .description("Time taken by the graceful kill sequence")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(elapsed);
    }

    /**
     * Increments the kill rejection counter.
     *
     * @param reason rejection reason (short-cooldown, window-cap)
     */
    public void incrementKillRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".kills.rejected")
                .description("Number of kill attempts rejected by the rate limiter")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a tick that ended with an unexpected exception.
     */
    public void incrementTickError() {
        Counter.builder(METRIC_PREFIX + ".tick.errors")
                .description("Number of control loop ticks that raised an exception")
                .register(registry)
                .increment();
    }
}
