package com.phillippitts.guardian.service.brownout;

import com.phillippitts.guardian.config.properties.BrownoutProperties;
import com.phillippitts.guardian.domain.BrownoutLevel;
import com.phillippitts.guardian.domain.BrownoutState;
import com.phillippitts.guardian.service.metrics.GuardianMetrics;
import com.phillippitts.guardian.service.serving.ServingApiClient;
import com.phillippitts.guardian.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Applies and reverts staged feature degradation on the serving system.
 *
 * <p>Levels are cumulative:
 * <ul>
 *   <li>LIGHT - switch to the fallback model</li>
 *   <li>MODERATE - LIGHT plus reduced context window, reduced RAG top-k and the moderate tool list disabled</li>
 *   <li>HEAVY - MODERATE plus the heavy tool list disabled (always a superset of the moderate list)</li>
 * </ul>
 *
 * <p>Each action is an independent call. An activation succeeds only if every call for the level
 * succeeds, and the recorded level changes only on success. A degrading call that went through
 * during a partly failed activation is still remembered, so {@link #deactivate()} restores the
 * serving system even though no level was ever recorded. Failed calls are logged and counted
 * but never retried here; the control loop retries on its next tick while the condition persists.
 *
 * <p>Not thread-safe: owned and driven exclusively by the control loop.
 */
public class BrownoutManager {

    private static final Logger LOG = LogManager.getLogger(BrownoutManager.class);

    private final ServingApiClient serving;
    private final BrownoutProperties props;
    private final GuardianMetrics metrics;
    private final Clock clock;

    private boolean active;
    private BrownoutLevel level = BrownoutLevel.NONE;
    private Instant activatedAt;
    private long failedCalls;
    private boolean degradationApplied;

    public BrownoutManager(ServingApiClient serving,
                           BrownoutProperties props,
                           GuardianMetrics metrics,
                           Clock clock) {
        this.serving = Objects.requireNonNull(serving, "serving");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Applies degradation at the given level. {@link BrownoutLevel#NONE} delegates to
     * {@link #deactivate()}.
     *
     * @param target level to apply
     * @return true if every call required for the level succeeded
     */
    public boolean activate(BrownoutLevel target) {
        Objects.requireNonNull(target, "target");
        if (target == BrownoutLevel.NONE) {
            return deactivate();
        }
        LOG.info("Activating brownout level {}", target);

        boolean success = true;
        if (target.includes(BrownoutLevel.LIGHT)) {
            success &= degrade("switch-model", () -> serving.switchModel(props.getModelFallback()));
        }
        if (target.includes(BrownoutLevel.MODERATE)) {
            success &= degrade("set-context-window", () -> serving.setContextWindow(props.getContextWindowReduced()));
            success &= degrade("set-rag-top-k", () -> serving.setRagTopK(props.getRagTopKReduced()));
            success &= degrade("disable-tools", () -> serving.disableTools(props.getModerateTools()));
        }
        if (target.includes(BrownoutLevel.HEAVY)) {
            success &= degrade("disable-tools", () -> serving.disableTools(props.heavyDisabledTools()));
        }

        if (!success) {
            LOG.error("Failed to fully activate brownout level {}; remaining at {}", target, level);
            return false;
        }
        if (!active) {
            activatedAt = clock.instant();
        }
        active = true;
        level = target;
        LOG.info("Brownout level {} activated", target);
        return true;
    }

    /**
     * Restores primary model, normal context and top-k, and re-enables all tools.
     *
     * <p>Idempotent. Returns true without any outbound call when nothing was degraded.
     *
     * @return true if every restore call succeeded
     */
    public boolean deactivate() {
        if (!needsRestore()) {
            return true;
        }
        LOG.info("Deactivating brownout - restoring normal operation");

        boolean success = true;
        success &= call("switch-model", () -> serving.switchModel(props.getModelPrimary()));
        success &= call("set-context-window", () -> serving.setContextWindow(props.getContextWindowNormal()));
        success &= call("set-rag-top-k", () -> serving.setRagTopK(props.getRagTopKNormal()));
        success &= call("enable-all-tools", serving::enableAllTools);

        if (!success) {
            LOG.error("Failed to fully deactivate brownout; level {} still recorded", level);
            return false;
        }
        Duration lasted = activeDuration();
        active = false;
        degradationApplied = false;
        level = BrownoutLevel.NONE;
        activatedAt = null;
        LOG.info("Brownout deactivated after {}", TimeUtils.formatSeconds(lasted));
        return true;
    }

    public boolean isActive() {
        return active;
    }

    /** True when any degrading call has gone through since the last successful deactivation. */
    public boolean needsRestore() {
        return active || degradationApplied;
    }

    public BrownoutLevel currentLevel() {
        return level;
    }

    /**
     * Returns the current state with the duration computed at read time.
     */
    public BrownoutState getState() {
        return new BrownoutState(
                active,
                active ? level : BrownoutLevel.NONE,
                activatedAt,
                activeDuration(),
                failedCalls,
                props.getModelPrimary(),
                props.getModelFallback(),
                props.getContextWindowNormal(),
                props.getContextWindowReduced());
    }

    private Duration activeDuration() {
        if (!active || activatedAt == null) {
            return Duration.ZERO;
        }
        Duration d = Duration.between(activatedAt, clock.instant());
        return d.isNegative() ? Duration.ZERO : d;
    }

    private boolean degrade(String action, BooleanSupplier request) {
        boolean ok = call(action, request);
        if (ok) {
            degradationApplied = true;
        }
        return ok;
    }

    private boolean call(String action, BooleanSupplier request) {
        boolean ok;
        try {
            ok = request.getAsBoolean();
        } catch (RuntimeException e) {
            LOG.error("Brownout action {} raised: {}", action, e.toString());
            ok = false;
        }
        if (!ok) {
            failedCalls++;
            metrics.incrementBrownoutFailure(action);
            LOG.warn("Brownout action {} failed", action);
        }
        return ok;
    }
}
