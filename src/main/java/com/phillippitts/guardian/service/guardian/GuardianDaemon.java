package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link GuardianControlLoop#tick()} on the dedicated loop executor.
 *
 * <p>Ticks run back to back separated by the poll interval and never overlap. {@link #stop()}
 * cancels the token, which wakes the inter-tick wait, then waits for the in-flight tick to finish.
 * The loop thread is never interrupted, so a kill sequence that has started always completes.
 */
@Component
@ConditionalOnProperty(prefix = "guardian", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GuardianDaemon implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(GuardianDaemon.class);

    private final GuardianControlLoop loop;
    private final Executor executor;
    private final Duration pollInterval;
    private final Duration shutdownWait;

    private volatile CancellationToken token;
    private volatile CountDownLatch finished;
    private volatile boolean running;

    public GuardianDaemon(GuardianControlLoop loop,
                          @Qualifier("guardianLoopExecutor") Executor executor,
                          GuardianProperties props,
                          ThreadPoolProperties threadPoolProperties) {
        this(loop, executor, props.getPollInterval(),
                Duration.ofSeconds(threadPoolProperties.getLoop().getAwaitTerminationSeconds()));
    }

    GuardianDaemon(GuardianControlLoop loop, Executor executor, Duration pollInterval, Duration shutdownWait) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.shutdownWait = Objects.requireNonNull(shutdownWait, "shutdownWait");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        CancellationToken t = new CancellationToken();
        CountDownLatch done = new CountDownLatch(1);
        token = t;
        finished = done;
        running = true;
        executor.execute(() -> runLoop(t, done));
        LOG.info("Guardian daemon started (poll interval {}ms)", pollInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.info("Guardian daemon stopping; waiting for in-flight tick");
        token.cancel();
        try {
            if (!finished.await(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Guardian loop still busy after {}s; leaving it to finish", shutdownWait.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for guardian loop to stop");
        } finally {
            running = false;
        }
        LOG.info("Guardian daemon stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runLoop(CancellationToken t, CountDownLatch done) {
        try {
            while (!t.isCancelled()) {
                loop.tick();
                if (t.awaitCancellation(pollInterval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Guardian loop interrupted; exiting");
        } finally {
            done.countDown();
        }
    }
}
