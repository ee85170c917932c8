package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.config.properties.BrownoutProperties;
import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.config.properties.KillSequenceProperties;
import com.phillippitts.guardian.domain.BrownoutLevel;
import com.phillippitts.guardian.domain.GuardianState;
import com.phillippitts.guardian.domain.GuardianStatus;
import com.phillippitts.guardian.domain.KillPhase;
import com.phillippitts.guardian.service.brownout.BrownoutManager;
import com.phillippitts.guardian.service.events.GuardianStateChangedEvent;
import com.phillippitts.guardian.service.events.KillSequenceCompletedEvent;
import com.phillippitts.guardian.service.events.LockdownEnteredEvent;
import com.phillippitts.guardian.service.killswitch.GracefulKillSequence;
import com.phillippitts.guardian.service.metrics.GuardianMetrics;
import com.phillippitts.guardian.service.process.PidFile;
import com.phillippitts.guardian.testutil.EventCapturingPublisher;
import com.phillippitts.guardian.testutil.FakeBackendProcessController;
import com.phillippitts.guardian.testutil.FakeInferenceBackendClient;
import com.phillippitts.guardian.testutil.FakeServingApiClient;
import com.phillippitts.guardian.testutil.MutableClock;
import com.phillippitts.guardian.testutil.RecordingSleeper;
import com.phillippitts.guardian.testutil.ScriptedMetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class GuardianControlLoopTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private GuardianProperties props;
    private BrownoutProperties brownoutProps;
    private ScriptedMetricsCollector collector;
    private FakeServingApiClient serving;
    private FakeBackendProcessController processes;
    private FakeInferenceBackendClient backend;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private PidFile pidFile;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        props = new GuardianProperties();
        props.setMetricsLoggingEnabled(false);
        brownoutProps = new BrownoutProperties();
        collector = new ScriptedMetricsCollector(clock);
        serving = new FakeServingApiClient();
        processes = new FakeBackendProcessController().withRunning(111);
        backend = new FakeInferenceBackendClient();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        pidFile = new PidFile(tempDir.resolve("backend.pid"));
    }

    private GuardianControlLoop newLoop() {
        GuardianMetrics metrics = new GuardianMetrics(registry);
        BrownoutManager brownout = new BrownoutManager(serving, brownoutProps, metrics, clock);
        GracefulKillSequence kill = new GracefulKillSequence(serving, processes, backend, pidFile,
                new KillSequenceProperties(), new RecordingSleeper(clock), clock);
        return new GuardianControlLoop(props, collector, brownout, kill, metrics, publisher, clock);
    }

    private void tick(GuardianControlLoop loop, double ram, double cpu) {
        collector.set(ram, cpu);
        loop.tick();
        clock.advanceSeconds(1);
    }

    private long transitionsTo(GuardianState state) {
        return publisher.eventsOf(GuardianStateChangedEvent.class).stream()
                .filter(e -> e.to() == state)
                .count();
    }

    @Test
    void brownoutFiresExactlyOnceAfterThreeConsecutiveSoftSamples() {
        GuardianControlLoop loop = newLoop();
        double[] cpu = {85, 85, 50, 85, 85};
        for (double c : cpu) {
            tick(loop, 50, c);
            assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        }

        tick(loop, 50, 85);

        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(transitionsTo(GuardianState.BROWNOUT)).isEqualTo(1);
        assertThat(serving.model).isEqualTo(brownoutProps.getModelFallback());
        assertThat(serving.contextWindow).isEqualTo(brownoutProps.getContextWindowReduced());
        assertThat(serving.ragTopK).isEqualTo(brownoutProps.getRagTopKReduced());
    }

    @Test
    void sustainedPressureUnderBrownoutEscalatesToDegradedWithHeavyTools() {
        GuardianControlLoop loop = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(loop, 85, 50);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);

        for (int i = 0; i < 3; i++) {
            tick(loop, 85, 50);
        }

        assertThat(loop.state()).isEqualTo(GuardianState.DEGRADED);
        assertThat(loop.currentStatus().brownout().level()).isEqualTo(BrownoutLevel.HEAVY);
        assertThat(serving.disabledToolCalls().get(serving.disabledToolCalls().size() - 1))
                .containsAll(brownoutProps.getModerateTools())
                .containsAll(brownoutProps.getHeavyTools());
    }

    @Test
    void hardThresholdGoesToEmergencyWithinOneTickAndKillRestoresNormal() {
        GuardianControlLoop loop = newLoop();

        tick(loop, 95, 10);

        assertThat(transitionsTo(GuardianState.EMERGENCY)).isEqualTo(1);
        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        assertThat(processes.terminated()).containsExactly(111L);
        assertThat(processes.launches()).isEqualTo(1);
        assertThat(pidFile.path()).hasContent("5000");
        assertThat(publisher.eventsOf(KillSequenceCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.outcome().success()).isTrue());
        assertThat(serving.intakeStopped).isFalse();
        assertThat(loop.currentStatus().killsInWindow()).isEqualTo(1);
    }

    @Test
    void secondEmergencyInsideShortCooldownLocksDownWithoutKilling() {
        GuardianControlLoop loop = newLoop();
        tick(loop, 95, 10);
        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);

        clock.advanceSeconds(100);
        tick(loop, 95, 10);

        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);
        assertThat(processes.launches()).isEqualTo(1);
        assertThat(publisher.eventsOf(LockdownEnteredEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.reason()).contains("short-cooldown"));
        assertThat(registry.get("guardian.kills.rejected").tag("reason", "short-cooldown").counter().count())
                .isEqualTo(1.0);
        assertThat(loop.currentStatus().requiresManualIntervention()).isTrue();
    }

    @Test
    void failedKillEntersLockdownUntilDurationElapses() {
        processes = new FakeBackendProcessController().withRunning(111).unkillable(111);
        GuardianControlLoop loop = newLoop();

        tick(loop, 95, 10);

        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);
        GuardianStatus status = loop.currentStatus();
        assertThat(status.killSequence().lastOutcome().success()).isFalse();
        Instant until = status.lockdownUntil();
        assertThat(until).isNotNull();

        // Metrics are ignored while locked down
        tick(loop, 10, 10);
        tick(loop, 99, 99);
        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);

        clock.set(until);
        tick(loop, 99, 99);

        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        assertThat(loop.currentStatus().lockdownUntil()).isNull();
    }

    @Test
    void killSequenceExceptionEndsInLockdownWithIntakeHeld() {
        backend.healthFailure = new IllegalStateException("backend socket closed");
        GuardianControlLoop loop = newLoop();

        assertThatCode(() -> tick(loop, 95, 10)).doesNotThrowAnyException();

        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);
        assertThat(loop.currentStatus().killSequence().lastOutcome().failedPhase()).isEqualTo(KillPhase.HEALTH_GATE);
        assertThat(publisher.eventsOf(LockdownEnteredEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo("kill sequence failed at HEALTH_GATE"));
        assertThat(registry.get("guardian.tick.errors").counter().count()).isZero();
        assertThat(serving.intakeStopped).isTrue();

        // Good samples do not shortcut the lockdown
        for (int i = 0; i < 60; i++) {
            tick(loop, 40, 20);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);
        assertThat(serving.intakeStopped).isTrue();

        clock.set(loop.currentStatus().lockdownUntil());
        tick(loop, 40, 20);

        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        assertThat(serving.intakeStopped).isFalse();
    }

    @Test
    void emergencyWithKillsEnabledNeverRecoversWithoutAKill() {
        processes = new FakeBackendProcessController().withRunning(111).unkillable(111);
        GuardianControlLoop loop = newLoop();

        tick(loop, 95, 10);
        for (int i = 0; i < 60; i++) {
            tick(loop, 40, 20);
        }

        assertThat(loop.state()).isEqualTo(GuardianState.LOCKDOWN);
        assertThat(transitionsTo(GuardianState.NORMAL)).isZero();
    }

    @Test
    void endToEndBrownoutThenRecoveryAfterFortyFiveSeconds() {
        GuardianControlLoop loop = newLoop();
        for (int i = 1; i <= 3; i++) {
            tick(loop, 50, 85);
            assertThat(loop.state()).isEqualTo(i < 3 ? GuardianState.NORMAL : GuardianState.BROWNOUT);
        }

        Instant firstGood = clock.instant();
        while (loop.state() == GuardianState.BROWNOUT && clock.instant().isBefore(firstGood.plusSeconds(120))) {
            tick(loop, 50, 70);
        }

        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        Duration held = Duration.between(firstGood, clock.instant().minusSeconds(1));
        assertThat(held).isEqualTo(Duration.ofSeconds(45));
        assertThat(serving.model).isEqualTo(brownoutProps.getModelPrimary());
        assertThat(serving.calls()).endsWith("enable-all-tools");
        assertThat(loop.currentStatus().brownout().active()).isFalse();
    }

    @Test
    void badSampleDuringRecoveryRestartsTheWindow() {
        GuardianControlLoop loop = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(loop, 50, 85);
        }
        for (int i = 0; i < 30; i++) {
            tick(loop, 50, 70);
        }
        tick(loop, 50, 78);
        for (int i = 0; i < 45; i++) {
            tick(loop, 50, 70);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);

        tick(loop, 50, 70);
        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
    }

    @Test
    void failedBrownoutActivationIsRetriedOnNextTick() {
        serving.failOn("set-rag-top-k");
        GuardianControlLoop loop = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(loop, 50, 85);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(loop.currentStatus().brownout().active()).isFalse();
        assertThat(loop.currentStatus().brownout().failedCalls()).isEqualTo(1);

        serving.recover();
        tick(loop, 50, 78);

        assertThat(loop.currentStatus().brownout().active()).isTrue();
        assertThat(loop.currentStatus().brownout().level()).isEqualTo(BrownoutLevel.MODERATE);
    }

    @Test
    void recoveryRestoresAPartlyAppliedBrownout() {
        serving.failOn("disable-tools");
        GuardianControlLoop loop = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(loop, 50, 85);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(loop.currentStatus().brownout().active()).isFalse();
        assertThat(serving.model).isEqualTo(brownoutProps.getModelFallback());

        for (int i = 0; i < 47 && loop.state() != GuardianState.NORMAL; i++) {
            tick(loop, 50, 50);
        }

        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
        assertThat(serving.model).isEqualTo(brownoutProps.getModelPrimary());
        assertThat(serving.calls()).endsWith("enable-all-tools");
    }

    @Test
    void killDisabledHoldsEmergencyUntilRecovery() {
        props.setKillEnabled(false);
        GuardianControlLoop loop = newLoop();

        tick(loop, 95, 10);
        tick(loop, 95, 10);
        assertThat(loop.state()).isEqualTo(GuardianState.EMERGENCY);
        assertThat(processes.terminated()).isEmpty();
        assertThat(loop.currentStatus().metrics().emergencyMode()).isTrue();

        for (int i = 0; i < 46; i++) {
            tick(loop, 50, 50);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.NORMAL);
    }

    @Test
    void brownoutDisabledChangesStateWithoutCallingServingSystem() {
        props.setBrownoutEnabled(false);
        GuardianControlLoop loop = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(loop, 50, 85);
        }
        assertThat(loop.state()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(serving.calls()).isEmpty();
    }

    @Test
    void tickSurvivesCollectorFailure() {
        GuardianControlLoop loop = newLoop();
        collector.failWith(new IllegalStateException("sensor exploded"));

        assertThatCode(loop::tick).doesNotThrowAnyException();
        assertThat(registry.get("guardian.tick.errors").counter().count()).isEqualTo(1.0);

        tick(loop, 50, 10);
        assertThat(loop.currentStatus().metrics().ramPct()).isEqualTo(50.0);
    }

    @Test
    void statusSnapshotCarriesDerivedFlagsAndTimings() {
        GuardianControlLoop loop = newLoop();
        assertThat(loop.currentStatus().state()).isEqualTo(GuardianState.NORMAL);

        for (int i = 0; i < 3; i++) {
            tick(loop, 85, 10);
        }
        for (int i = 0; i < 3; i++) {
            tick(loop, 85, 10);
        }

        GuardianStatus status = loop.currentStatus();
        assertThat(status.state()).isEqualTo(GuardianState.DEGRADED);
        assertThat(status.previousState()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(status.metrics().degraded()).isTrue();
        assertThat(status.metrics().intakeBlocked()).isFalse();
        assertThat(status.uptimeSeconds()).isEqualTo(5.0);
        assertThat(loop.recentMetrics()).hasSize(6);
    }

    @Test
    void tickKeyIsRemovedFromThreadContextAfterTick() {
        GuardianControlLoop loop = newLoop();
        tick(loop, 10, 10);
        assertThat(ThreadContext.get("tick")).isNull();
    }

    @Test
    void independentLoopsDoNotShareState() {
        GuardianControlLoop first = newLoop();
        GuardianControlLoop second = newLoop();
        for (int i = 0; i < 3; i++) {
            tick(first, 50, 85);
        }
        assertThat(first.state()).isEqualTo(GuardianState.BROWNOUT);
        assertThat(second.state()).isEqualTo(GuardianState.NORMAL);
    }
}
