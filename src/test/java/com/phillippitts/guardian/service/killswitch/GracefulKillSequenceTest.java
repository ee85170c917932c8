package com.phillippitts.guardian.service.killswitch;

import com.phillippitts.guardian.config.properties.KillSequenceProperties;
import com.phillippitts.guardian.domain.KillOutcome;
import com.phillippitts.guardian.domain.KillPhase;
import com.phillippitts.guardian.service.process.PidFile;
import com.phillippitts.guardian.testutil.FakeBackendProcessController;
import com.phillippitts.guardian.testutil.FakeInferenceBackendClient;
import com.phillippitts.guardian.testutil.FakeServingApiClient;
import com.phillippitts.guardian.testutil.MutableClock;
import com.phillippitts.guardian.testutil.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GracefulKillSequenceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private FakeServingApiClient serving;
    private FakeInferenceBackendClient backend;
    private KillSequenceProperties props;
    private PidFile pidFile;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        sleeper = new RecordingSleeper(clock);
        serving = new FakeServingApiClient();
        backend = new FakeInferenceBackendClient();
        props = new KillSequenceProperties();
        pidFile = new PidFile(tempDir.resolve("backend.pid"));
    }

    private GracefulKillSequence sequence(FakeBackendProcessController processes) {
        return new GracefulKillSequence(serving, processes, backend, pidFile, props, sleeper, clock);
    }

    @Test
    void happyPathRunsAllPhasesInOrder() {
        FakeBackendProcessController processes = new FakeBackendProcessController().withRunning(111, 222);
        backend.loadedModels.add("gpt-oss:20b");

        KillOutcome outcome = sequence(processes).execute();

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.newPid()).isEqualTo(5000L);
        assertThat(serving.calls()).containsExactly("stop-intake", "resume-intake");
        assertThat(processes.terminated()).containsExactly(111L, 222L);
        assertThat(processes.forceKilled()).isEmpty();
        assertThat(backend.unloaded).containsExactly("gpt-oss:20b");
        assertThat(backend.smokeTests).isEqualTo(1);
        assertThat(pidFile.path()).hasContent("5000");
        // drain, sigterm wait, first restart delay, startup wait
        assertThat(sleeper.sleeps()).containsExactly(
                Duration.ofSeconds(8), Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(2));
        assertThat(outcome.elapsed()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void noMatchingProcessesStillRelaunches() {
        FakeBackendProcessController processes = new FakeBackendProcessController();

        KillOutcome outcome = sequence(processes).execute();

        assertThat(outcome.success()).isTrue();
        assertThat(processes.terminated()).isEmpty();
        assertThat(processes.launches()).isEqualTo(1);
    }

    @Test
    void survivorsOfSigtermAreForceKilledAndNoneRemain() {
        FakeBackendProcessController processes = new FakeBackendProcessController()
                .withRunning(111, 222)
                .stubborn(222);

        KillOutcome outcome = sequence(processes).execute();

        assertThat(outcome.success()).isTrue();
        assertThat(processes.forceKilled()).containsExactly(222L);
        assertThat(processes.isAlive(111)).isFalse();
        assertThat(processes.isAlive(222)).isFalse();
        assertThat(sleeper.sleeps()).contains(Duration.ofSeconds(1));
    }

    @Test
    void processSurvivingSigkillFailsTerminatePhase() {
        FakeBackendProcessController processes = new FakeBackendProcessController()
                .withRunning(111)
                .unkillable(111);

        KillOutcome outcome = sequence(processes).execute();

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failedPhase()).isEqualTo(KillPhase.TERMINATE);
        assertThat(processes.launches()).isZero();
        assertThat(serving.calls()).containsExactly("stop-intake");
    }

    @Test
    void restartRetriesWithBackoffScheduleAndResetsAttempts() {
        FakeBackendProcessController processes = new FakeBackendProcessController().failNextLaunches(2);
        GracefulKillSequence sequence = sequence(processes);

        KillOutcome outcome = sequence.execute();

        assertThat(outcome.success()).isTrue();
        assertThat(processes.launches()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsSubsequence(
                Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(60));
        assertThat(sequence.getStatus().restartAttempts()).isZero();
    }

    @Test
    void exhaustedRestartsFailRestartPhase() {
        FakeBackendProcessController processes = new FakeBackendProcessController().launchedProcessesExit();
        GracefulKillSequence sequence = sequence(processes);

        KillOutcome outcome = sequence.execute();

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failedPhase()).isEqualTo(KillPhase.RESTART);
        assertThat(processes.launches()).isEqualTo(3);
        assertThat(sequence.getStatus().restartAttempts()).isEqualTo(3);
        assertThat(pidFile.path()).doesNotExist();
    }

    @Test
    void backoffReusesLastDelayBeyondSchedule() {
        props.setMaxRestartAttempts(5);
        FakeBackendProcessController processes = new FakeBackendProcessController().failNextLaunches(4);

        assertThat(sequence(processes).execute().success()).isTrue();
        assertThat(sleeper.sleeps()).containsSubsequence(
                Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(60),
                Duration.ofSeconds(60), Duration.ofSeconds(60));
    }

    @Test
    void unhealthyBackendFailsHealthGate() {
        backend.healthy = false;
        GracefulKillSequence sequence = sequence(new FakeBackendProcessController().withRunning(111));

        KillOutcome outcome = sequence.execute();

        assertThat(outcome.failedPhase()).isEqualTo(KillPhase.HEALTH_GATE);
        assertThat(serving.calls()).doesNotContain("resume-intake");
        assertThat(sequence.getStatus().lastOutcome()).isEqualTo(outcome);
        assertThat(sequence.getStatus().lastExecution()).isNull();
    }

    @Test
    void failingSmokeTestDoesNotFailSequence() {
        backend.smokeTestPasses = false;

        KillOutcome outcome = sequence(new FakeBackendProcessController()).execute();

        assertThat(outcome.success()).isTrue();
        assertThat(backend.smokeTests).isEqualTo(1);
    }

    @Test
    void smokeTestCanBeDisabled() {
        props.setSmokeTestEnabled(false);
        sequence(new FakeBackendProcessController()).execute();
        assertThat(backend.smokeTests).isZero();
    }

    @Test
    void intakeFailuresAreSoft() {
        serving.failOn("stop-intake");
        serving.failOn("resume-intake");

        KillOutcome outcome = sequence(new FakeBackendProcessController().withRunning(7)).execute();

        assertThat(outcome.success()).isTrue();
        assertThat(sleeper.sleeps().get(0)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void statusReportsLastSuccessfulRun() {
        GracefulKillSequence sequence = sequence(new FakeBackendProcessController());
        assertThat(sequence.getStatus().lastOutcome()).isNull();

        sequence.execute();

        assertThat(sequence.getStatus().lastExecution()).isEqualTo(clock.instant().minusSeconds(15));
        assertThat(sequence.getStatus().running()).isFalse();
        assertThat(sequence.getStatus().maxAttempts()).isEqualTo(3);
        assertThat(sequence.getStatus().pidFile()).endsWith("backend.pid");
    }

    @Test
    void collaboratorExceptionFailsTheRunningPhase() {
        backend.healthFailure = new IllegalStateException("connection reset");

        GracefulKillSequence sequence = sequence(new FakeBackendProcessController().withRunning(7));
        KillOutcome outcome = sequence.execute();

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failedPhase()).isEqualTo(KillPhase.HEALTH_GATE);
        assertThat(sequence.getStatus().lastOutcome()).isEqualTo(outcome);
        assertThat(sequence.getStatus().running()).isFalse();
        assertThat(serving.calls()).containsExactly("stop-intake");
        assertThat(serving.intakeStopped).isTrue();
    }

    @Test
    void releaseIntakeResumesOnlyAfterAFailedRun() {
        GracefulKillSequence sequence = sequence(new FakeBackendProcessController().withRunning(7).unkillable(7));
        assertThat(sequence.releaseIntake()).isTrue();
        assertThat(serving.calls()).isEmpty();

        assertThat(sequence.execute().failedPhase()).isEqualTo(KillPhase.TERMINATE);
        assertThat(serving.intakeStopped).isTrue();

        serving.failOn("resume-intake");
        assertThat(sequence.releaseIntake()).isFalse();
        assertThat(serving.intakeStopped).isTrue();

        serving.recover();
        assertThat(sequence.releaseIntake()).isTrue();
        assertThat(serving.intakeStopped).isFalse();

        serving.clearCalls();
        assertThat(sequence.releaseIntake()).isTrue();
        assertThat(serving.calls()).isEmpty();
    }

    @Test
    void successfulRunLeavesNothingToRelease() {
        GracefulKillSequence sequence = sequence(new FakeBackendProcessController().withRunning(7));
        sequence.execute();
        serving.clearCalls();

        assertThat(sequence.releaseIntake()).isTrue();
        assertThat(serving.calls()).isEmpty();
    }
}
