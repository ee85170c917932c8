package com.phillippitts.guardian.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Thresholds, hysteresis windows and kill rate limits for the guardian control loop.
 *
 * <p>All percentages are 0..100. Recovery thresholds must sit strictly below the soft
 * thresholds and soft below hard; this ordering is enforced at startup by
 * {@link com.phillippitts.guardian.config.ThresholdConfigurationValidator}.
 *
 * <p>Example application.properties:
 * <pre>
 * guardian.poll-interval=1s
 * guardian.ram-soft-pct=80
 * guardian.ram-hard-pct=92
 * guardian.measurement-window=3
 * guardian.recovery-window=45s
 * guardian.kill-cooldown-short=300s
 * </pre>
 */
@ConfigurationProperties(prefix = "guardian")
@Validated
public class GuardianProperties {

    /** Run the control loop daemon. Disable to expose status only (tests, dry runs). */
    private boolean enabled = true;

    /** Delay between the end of one tick and the start of the next. */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double ramSoftPct = 80.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double ramHardPct = 92.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double ramRecoveryPct = 70.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double cpuSoftPct = 80.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double cpuHardPct = 92.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double cpuRecoveryPct = 75.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double diskHardPct = 95.0;

    /** Hard temperature limit, only evaluated when a sensor is readable. */
    @Positive(message = "Temperature limit must be positive")
    private double tempHardC = 90.0;

    /** Consecutive soft-trigger ticks required before escalating. */
    @Positive(message = "Measurement window must be positive")
    private int measurementWindow = 3;

    /** Continuous good-sample time required before returning to NORMAL. */
    @NotNull
    private Duration recoveryWindow = Duration.ofSeconds(45);

    /** Number of metric snapshots retained for status and diagnostics. */
    @Positive(message = "History size must be positive")
    private int historySize = 15;

    /** Minimum time between two kills. */
    @NotNull
    private Duration killCooldownShort = Duration.ofSeconds(300);

    /** Rolling window for the kill cap. */
    @NotNull
    private Duration killCooldownLong = Duration.ofSeconds(1800);

    @Positive(message = "Max kills per window must be positive")
    private int maxKillsPerWindow = 3;

    @NotNull
    private Duration lockdownDuration = Duration.ofSeconds(3600);

    /** Issue brownout calls to the serving system. State changes happen either way. */
    private boolean brownoutEnabled = true;

    /** Allow the kill sequence to run on EMERGENCY. */
    private boolean killEnabled = true;

    /** Log a structured metrics line on every tick. */
    private boolean metricsLoggingEnabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public double getRamSoftPct() {
        return ramSoftPct;
    }

    public void setRamSoftPct(double ramSoftPct) {
        this.ramSoftPct = ramSoftPct;
    }

    public double getRamHardPct() {
        return ramHardPct;
    }

    public void setRamHardPct(double ramHardPct) {
        this.ramHardPct = ramHardPct;
    }

    public double getRamRecoveryPct() {
        return ramRecoveryPct;
    }

    public void setRamRecoveryPct(double ramRecoveryPct) {
        this.ramRecoveryPct = ramRecoveryPct;
    }

    public double getCpuSoftPct() {
        return cpuSoftPct;
    }

    public void setCpuSoftPct(double cpuSoftPct) {
        this.cpuSoftPct = cpuSoftPct;
    }

    public double getCpuHardPct() {
        return cpuHardPct;
    }

    public void setCpuHardPct(double cpuHardPct) {
        this.cpuHardPct = cpuHardPct;
    }

    public double getCpuRecoveryPct() {
        return cpuRecoveryPct;
    }

    public void setCpuRecoveryPct(double cpuRecoveryPct) {
        this.cpuRecoveryPct = cpuRecoveryPct;
    }

    public double getDiskHardPct() {
        return diskHardPct;
    }

    public void setDiskHardPct(double diskHardPct) {
        this.diskHardPct = diskHardPct;
    }

    public double getTempHardC() {
        return tempHardC;
    }

    public void setTempHardC(double tempHardC) {
        this.tempHardC = tempHardC;
    }

    public int getMeasurementWindow() {
        return measurementWindow;
    }

    public void setMeasurementWindow(int measurementWindow) {
        this.measurementWindow = measurementWindow;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    public void setRecoveryWindow(Duration recoveryWindow) {
        this.recoveryWindow = recoveryWindow;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public Duration getKillCooldownShort() {
        return killCooldownShort;
    }

    public void setKillCooldownShort(Duration killCooldownShort) {
        this.killCooldownShort = killCooldownShort;
    }

    public Duration getKillCooldownLong() {
        return killCooldownLong;
    }

    public void setKillCooldownLong(Duration killCooldownLong) {
        this.killCooldownLong = killCooldownLong;
    }

    public int getMaxKillsPerWindow() {
        return maxKillsPerWindow;
    }

    public void setMaxKillsPerWindow(int maxKillsPerWindow) {
        this.maxKillsPerWindow = maxKillsPerWindow;
    }

    public Duration getLockdownDuration() {
        return lockdownDuration;
    }

    public void setLockdownDuration(Duration lockdownDuration) {
        this.lockdownDuration = lockdownDuration;
    }

    public boolean isBrownoutEnabled() {
        return brownoutEnabled;
    }

    public void setBrownoutEnabled(boolean brownoutEnabled) {
        this.brownoutEnabled = brownoutEnabled;
    }

    public boolean isKillEnabled() {
        return killEnabled;
    }

    public void setKillEnabled(boolean killEnabled) {
        this.killEnabled = killEnabled;
    }

    public boolean isMetricsLoggingEnabled() {
        return metricsLoggingEnabled;
    }

    public void setMetricsLoggingEnabled(boolean metricsLoggingEnabled) {
        this.metricsLoggingEnabled = metricsLoggingEnabled;
    }
}
