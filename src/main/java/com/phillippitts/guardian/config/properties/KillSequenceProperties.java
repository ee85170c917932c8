package com.phillippitts.guardian.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the graceful kill sequence (prefix {@code guardian.kill-sequence}).
 *
 * <p>{@code restart-delays} is a fixed schedule, not a formula: attempt {@code n} waits
 * {@code restartDelays[min(n, size - 1)]} before launching.
 */
@ConfigurationProperties(prefix = "guardian.kill-sequence")
@Validated
public class KillSequenceProperties {

    /** Time to let in-flight requests finish after intake is stopped. */
    @NotNull
    private Duration drainTimeout = Duration.ofSeconds(8);

    /** Grace period between SIGTERM and SIGKILL. */
    @NotNull
    private Duration sigtermTimeout = Duration.ofSeconds(5);

    /** Wait after SIGKILL before the final survivor check. */
    @NotNull
    private Duration forceKillWait = Duration.ofSeconds(1);

    /** Time a relaunched backend must stay alive to count as started. */
    @NotNull
    private Duration startupWait = Duration.ofSeconds(2);

    @NotEmpty(message = "Restart delay schedule must not be empty")
    private List<Duration> restartDelays = new ArrayList<>(List.of(
            Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(60)));

    @Positive(message = "Max restart attempts must be positive")
    private int maxRestartAttempts = 3;

    /** PID hint file. Never authoritative; processes are always re-enumerated. */
    @NotBlank
    private String pidFile = "/tmp/guardian_backend.pid";

    /** Command used to relaunch the backend. */
    @NotEmpty
    private List<String> launchCommand = new ArrayList<>(List.of("ollama", "serve"));

    /** Executable basename of the backend's canonical serve invocation. */
    @NotBlank
    private String backendExecutable = "ollama";

    /** First argument of the backend's canonical serve invocation. */
    @NotBlank
    private String serveSubcommand = "serve";

    /** Issue a minimal generate request after the health check. Never fails the gate. */
    private boolean smokeTestEnabled = true;

    @NotBlank
    private String smokeTestModel = "llama3.2:3b";

    @NotBlank
    private String smokeTestPrompt = "2+2=";

    /**
     * Delay before restart attempt {@code attempt} (zero-based). Reuses the last scheduled
     * delay once attempts exceed the schedule length.
     */
    public Duration restartDelay(int attempt) {
        int idx = Math.min(Math.max(attempt, 0), restartDelays.size() - 1);
        return restartDelays.get(idx);
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Duration getSigtermTimeout() {
        return sigtermTimeout;
    }

    public void setSigtermTimeout(Duration sigtermTimeout) {
        this.sigtermTimeout = sigtermTimeout;
    }

    public Duration getForceKillWait() {
        return forceKillWait;
    }

    public void setForceKillWait(Duration forceKillWait) {
        this.forceKillWait = forceKillWait;
    }

    public Duration getStartupWait() {
        return startupWait;
    }

    public void setStartupWait(Duration startupWait) {
        this.startupWait = startupWait;
    }

    public List<Duration> getRestartDelays() {
        return restartDelays;
    }

    public void setRestartDelays(List<Duration> restartDelays) {
        this.restartDelays = restartDelays;
    }

    public int getMaxRestartAttempts() {
        return maxRestartAttempts;
    }

    public void setMaxRestartAttempts(int maxRestartAttempts) {
        this.maxRestartAttempts = maxRestartAttempts;
    }

    public String getPidFile() {
        return pidFile;
    }

    public void setPidFile(String pidFile) {
        this.pidFile = pidFile;
    }

    public List<String> getLaunchCommand() {
        return launchCommand;
    }

    public void setLaunchCommand(List<String> launchCommand) {
        this.launchCommand = launchCommand;
    }

    public String getBackendExecutable() {
        return backendExecutable;
    }

    public void setBackendExecutable(String backendExecutable) {
        this.backendExecutable = backendExecutable;
    }

    public String getServeSubcommand() {
        return serveSubcommand;
    }

    public void setServeSubcommand(String serveSubcommand) {
        this.serveSubcommand = serveSubcommand;
    }

    public boolean isSmokeTestEnabled() {
        return smokeTestEnabled;
    }

    public void setSmokeTestEnabled(boolean smokeTestEnabled) {
        this.smokeTestEnabled = smokeTestEnabled;
    }

    public String getSmokeTestModel() {
        return smokeTestModel;
    }

    public void setSmokeTestModel(String smokeTestModel) {
        this.smokeTestModel = smokeTestModel;
    }

    public String getSmokeTestPrompt() {
        return smokeTestPrompt;
    }

    public void setSmokeTestPrompt(String smokeTestPrompt) {
        this.smokeTestPrompt = smokeTestPrompt;
    }
}
