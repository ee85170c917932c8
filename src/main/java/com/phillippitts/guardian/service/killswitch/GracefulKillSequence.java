package com.phillippitts.guardian.service.killswitch;

import com.phillippitts.guardian.config.properties.KillSequenceProperties;
import com.phillippitts.guardian.domain.KillOutcome;
import com.phillippitts.guardian.domain.KillPhase;
import com.phillippitts.guardian.domain.KillSequenceStatus;
import com.phillippitts.guardian.exception.ProcessControlException;
import com.phillippitts.guardian.service.backend.InferenceBackendClient;
import com.phillippitts.guardian.service.process.BackendProcessController;
import com.phillippitts.guardian.service.process.PidFile;
import com.phillippitts.guardian.service.serving.ServingApiClient;
import com.phillippitts.guardian.util.Sleeper;
import com.phillippitts.guardian.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;

/**
 * Replaces a runaway inference backend in five phases:
 * <ol>
 *   <li>Stop intake and drain in-flight requests (soft)</li>
 *   <li>SIGTERM every backend process, SIGKILL survivors, verify none remain (hard)</li>
 *   <li>Relaunch with backoff (hard)</li>
 *   <li>Health gate: health endpoint must answer 2xx; smoke test is informational (hard)</li>
 *   <li>Resume intake (soft)</li>
 * </ol>
 *
 * <p>Soft phases log a warning and continue. Hard phases abort the sequence with a failed
 * {@link KillOutcome} naming the phase. An unexpected exception from a collaborator fails the
 * phase that was running. A started sequence always runs to an outcome; it does not observe
 * cancellation.
 *
 * <p>If the sequence fails after intake was stopped, intake stays stopped until
 * {@link #releaseIntake()} is called.
 */
public class GracefulKillSequence {

    private static final Logger LOG = LogManager.getLogger(GracefulKillSequence.class);

    private final ServingApiClient serving;
    private final BackendProcessController processes;
    private final InferenceBackendClient backend;
    private final PidFile pidFile;
    private final KillSequenceProperties props;
    private final Sleeper sleeper;
    private final Clock clock;

    private volatile boolean running;
    private volatile Instant lastExecution;
    private volatile int restartAttempts;
    private volatile KillOutcome lastOutcome;
    private volatile KillPhase phase;
    private boolean intakeHeld;
    private boolean interruptedDuringRun;

    public GracefulKillSequence(ServingApiClient serving,
                                BackendProcessController processes,
                                InferenceBackendClient backend,
                                PidFile pidFile,
                                KillSequenceProperties props,
                                Sleeper sleeper,
                                Clock clock) {
        this.serving = Objects.requireNonNull(serving, "serving");
        this.processes = Objects.requireNonNull(processes, "processes");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.pidFile = Objects.requireNonNull(pidFile, "pidFile");
        this.props = Objects.requireNonNull(props, "props");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs all phases synchronously on the calling thread.
     *
     * @return success, or the first hard phase that failed
     */
    public KillOutcome execute() {
        Instant startedAt = clock.instant();
        running = true;
        interruptedDuringRun = false;
        LOG.warn("Graceful kill sequence started");
        try {
            KillOutcome outcome;
            try {
                outcome = runPhases(startedAt);
            } catch (RuntimeException e) {
                LOG.error("Kill sequence aborted by unexpected error in phase {}", phase, e);
                outcome = KillOutcome.failed(phase, startedAt, elapsedSince(startedAt));
            }
            lastOutcome = outcome;
            if (outcome.success()) {
                lastExecution = startedAt;
                LOG.info("Graceful kill sequence completed in {} (new PID {})",
                        TimeUtils.formatSeconds(outcome.elapsed()), outcome.newPid());
            } else {
                LOG.error("Graceful kill sequence failed at phase {} after {}",
                        outcome.failedPhase(), TimeUtils.formatSeconds(outcome.elapsed()));
            }
            return outcome;
        } finally {
            running = false;
            if (interruptedDuringRun) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Resumes intake left stopped by a failed sequence. No call is made when intake is not held.
     *
     * @return true if intake is no longer held by this sequence
     */
    public boolean releaseIntake() {
        if (!intakeHeld) {
            return true;
        }
        LOG.info("Releasing intake held since the last failed kill sequence");
        if (softCall("resume-intake", serving::resumeIntake)) {
            intakeHeld = false;
            return true;
        }
        LOG.warn("Resume-intake call failed; intake remains stopped");
        return false;
    }

    public KillSequenceStatus getStatus() {
        return new KillSequenceStatus(
                lastExecution,
                restartAttempts,
                props.getMaxRestartAttempts(),
                lastOutcome,
                pidFile.path().toString(),
                running);
    }

    private KillOutcome runPhases(Instant startedAt) {
        stopIntakeAndDrain();

        if (!terminateBackend()) {
            return KillOutcome.failed(KillPhase.TERMINATE, startedAt, elapsedSince(startedAt));
        }

        OptionalLong newPid = restartWithBackoff();
        if (newPid.isEmpty()) {
            return KillOutcome.failed(KillPhase.RESTART, startedAt, elapsedSince(startedAt));
        }

        if (!passesHealthGate()) {
            return KillOutcome.failed(KillPhase.HEALTH_GATE, startedAt, elapsedSince(startedAt));
        }

        resumeIntake();
        return KillOutcome.succeeded(startedAt, elapsedSince(startedAt), newPid.getAsLong());
    }

    // Phase 1
    private void stopIntakeAndDrain() {
        phase = KillPhase.STOP_INTAKE;
        LOG.info("Phase {}: stopping intake", phase);
        intakeHeld = true;
        if (!softCall("stop-intake", serving::stopIntake)) {
            LOG.warn("Stop-intake call failed; draining anyway");
        }
        LOG.info("Draining in-flight requests for {}", TimeUtils.formatSeconds(props.getDrainTimeout()));
        pause(props.getDrainTimeout());
    }

    // Phase 2
    private boolean terminateBackend() {
        phase = KillPhase.TERMINATE;
        LOG.info("Phase {}: terminating backend processes", phase);
        List<Long> pids = processes.findBackendPids();
        if (pids.isEmpty()) {
            LOG.warn("No backend processes found; nothing to terminate");
            return true;
        }
        LOG.info("Found backend PIDs {}", pids);

        stopActiveSessions();

        for (long pid : pids) {
            processes.terminate(pid);
        }
        pause(props.getSigtermTimeout());

        List<Long> survivors = processes.findBackendPids();
        if (!survivors.isEmpty()) {
            LOG.warn("PIDs {} survived SIGTERM; sending SIGKILL", survivors);
            for (long pid : survivors) {
                processes.forceKill(pid);
            }
            pause(props.getForceKillWait());
        }

        List<Long> remaining = processes.findBackendPids();
        if (!remaining.isEmpty()) {
            LOG.error("Backend PIDs {} still alive after SIGKILL", remaining);
            return false;
        }
        LOG.info("All backend processes terminated");
        return true;
    }

    // Best effort: ask the backend to unload loaded models before signalling it
    private void stopActiveSessions() {
        try {
            List<String> models = backend.runningModels();
            for (String model : models) {
                if (!backend.unloadModel(model)) {
                    LOG.debug("Could not unload model {}", model);
                }
            }
        } catch (RuntimeException e) {
            LOG.debug("Session stop skipped: {}", e.toString());
        }
    }

    // Phase 3
    private OptionalLong restartWithBackoff() {
        phase = KillPhase.RESTART;
        LOG.info("Phase {}: relaunching backend", phase);
        int max = props.getMaxRestartAttempts();
        for (int attempt = 0; attempt < max; attempt++) {
            Duration delay = props.restartDelay(attempt);
            LOG.info("Restart attempt {}/{} in {}", attempt + 1, max, TimeUtils.formatSeconds(delay));
            pause(delay);
            restartAttempts = attempt + 1;

            OptionalLong pid = launchOnce();
            if (pid.isPresent()) {
                restartAttempts = 0;
                if (!pidFile.write(pid.getAsLong())) {
                    LOG.warn("Could not record PID {} in {}", pid.getAsLong(), pidFile.path());
                }
                LOG.info("Backend relaunched with PID {}", pid.getAsLong());
                return pid;
            }
        }
        LOG.error("Backend relaunch failed after {} attempts", max);
        return OptionalLong.empty();
    }

    private OptionalLong launchOnce() {
        long pid;
        try {
            pid = processes.launch();
        } catch (ProcessControlException e) {
            LOG.warn("Launch failed: {}", e.getMessage());
            return OptionalLong.empty();
        }
        pause(props.getStartupWait());
        if (!processes.isAlive(pid)) {
            LOG.warn("Launched backend PID {} exited during startup", pid);
            return OptionalLong.empty();
        }
        return OptionalLong.of(pid);
    }

    // Phase 4
    private boolean passesHealthGate() {
        phase = KillPhase.HEALTH_GATE;
        LOG.info("Phase {}: checking backend health", phase);
        if (!backend.isHealthy()) {
            LOG.error("Backend health check failed after relaunch");
            return false;
        }
        if (props.isSmokeTestEnabled()) {
            boolean answered = softCall("smoke-test",
                    () -> backend.smokeTest(props.getSmokeTestModel(), props.getSmokeTestPrompt()));
            if (answered) {
                LOG.info("Smoke test passed (model {})", props.getSmokeTestModel());
            } else {
                LOG.warn("Smoke test failed (model {}); continuing since health check passed",
                        props.getSmokeTestModel());
            }
        }
        return true;
    }

    // Phase 5
    private void resumeIntake() {
        phase = KillPhase.RESUME_INTAKE;
        LOG.info("Phase {}: resuming intake", phase);
        if (softCall("resume-intake", serving::resumeIntake)) {
            intakeHeld = false;
        } else {
            LOG.warn("Resume-intake call failed; serving system may need manual resume");
        }
    }

    // Soft steps never abort the sequence
    private static boolean softCall(String step, BooleanSupplier call) {
        try {
            return call.getAsBoolean();
        } catch (RuntimeException e) {
            LOG.warn("Step {} raised: {}", step, e.toString());
            return false;
        }
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            // Never abandon a started sequence; restore the flag once it finishes
            interruptedDuringRun = true;
            LOG.warn("Interrupted while waiting {}; continuing kill sequence", TimeUtils.formatSeconds(duration));
        }
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration d = Duration.between(startedAt, clock.instant());
        return d.isNegative() ? Duration.ZERO : d;
    }
}
