package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.domain.SystemMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns raw samples into {@link Observation}s.
 *
 * <p>Hard thresholds act on a single sample. The soft trigger (RAM or CPU at or above its soft
 * threshold) must hold for a full measurement window. Recovery needs RAM and CPU both at or
 * below their recovery thresholds continuously for the recovery window; any other sample unsets
 * the recovery timer. {@link #reset()} is called on every state change.
 */
public class HysteresisTracker {

    private final GuardianProperties props;
    private final SlidingBooleanWindow softWindow;
    private Instant recoveryStartedAt;

    public HysteresisTracker(GuardianProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        this.softWindow = new SlidingBooleanWindow(props.getMeasurementWindow());
    }

    public Observation observe(SystemMetrics m, Instant now) {
        String hardReason = hardBreach(m);

        boolean soft = m.ramPct() >= props.getRamSoftPct() || m.cpuPct() >= props.getCpuSoftPct();
        softWindow.add(soft);

        boolean good = m.ramPct() <= props.getRamRecoveryPct() && m.cpuPct() <= props.getCpuRecoveryPct();
        boolean recovered = false;
        if (good) {
            if (recoveryStartedAt == null) {
                recoveryStartedAt = now;
            }
            recovered = Duration.between(recoveryStartedAt, now).compareTo(props.getRecoveryWindow()) >= 0;
        } else {
            recoveryStartedAt = null;
        }

        return new Observation(hardReason != null, hardReason, softWindow.isSaturated(), recovered);
    }

    /** Clears the soft window and the recovery timer. */
    public void reset() {
        softWindow.clear();
        recoveryStartedAt = null;
    }

    Instant recoveryStartedAt() {
        return recoveryStartedAt;
    }

    private String hardBreach(SystemMetrics m) {
        if (m.ramPct() >= props.getRamHardPct()) {
            return describe("ram", m.ramPct(), props.getRamHardPct(), "%");
        }
        if (m.cpuPct() >= props.getCpuHardPct()) {
            return describe("cpu", m.cpuPct(), props.getCpuHardPct(), "%");
        }
        if (m.diskPct() >= props.getDiskHardPct()) {
            return describe("disk", m.diskPct(), props.getDiskHardPct(), "%");
        }
        if (m.tempC() != null && m.tempC() >= props.getTempHardC()) {
            return describe("temp", m.tempC(), props.getTempHardC(), "C");
        }
        return null;
    }

    private static String describe(String what, double value, double limit, String unit) {
        return String.format(Locale.ROOT, "%s %.1f%s >= %.1f%s", what, value, unit, limit, unit);
    }
}
