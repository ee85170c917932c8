package com.phillippitts.guardian.config;

import com.phillippitts.guardian.config.properties.BrownoutProperties;
import com.phillippitts.guardian.config.properties.GuardianProperties;
import com.phillippitts.guardian.config.properties.InferenceBackendProperties;
import com.phillippitts.guardian.config.properties.KillSequenceProperties;
import com.phillippitts.guardian.config.properties.ServingApiProperties;
import com.phillippitts.guardian.service.backend.HttpInferenceBackendClient;
import com.phillippitts.guardian.service.backend.InferenceBackendClient;
import com.phillippitts.guardian.service.brownout.BrownoutManager;
import com.phillippitts.guardian.service.guardian.GuardianControlLoop;
import com.phillippitts.guardian.service.killswitch.GracefulKillSequence;
import com.phillippitts.guardian.service.metrics.GuardianMetrics;
import com.phillippitts.guardian.service.metrics.MetricsCollector;
import com.phillippitts.guardian.service.metrics.OshiMetricsCollector;
import com.phillippitts.guardian.service.process.BackendProcessController;
import com.phillippitts.guardian.service.process.BackendProcessMatcher;
import com.phillippitts.guardian.service.process.DefaultProcessFactory;
import com.phillippitts.guardian.service.process.OsBackendProcessController;
import com.phillippitts.guardian.service.process.PidFile;
import com.phillippitts.guardian.service.process.ProcessFactory;
import com.phillippitts.guardian.service.serving.HttpServingApiClient;
import com.phillippitts.guardian.service.serving.ServingApiClient;
import com.phillippitts.guardian.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import oshi.SystemInfo;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the guardian from its configuration properties.
 *
 * <p>Every collaborator of the control loop is a bean behind an interface so tests can
 * replace the network and process edges without touching the loop itself.
 */
@Configuration
public class GuardianConfig {

    private static final Logger LOG = LogManager.getLogger(GuardianConfig.class);

    /** CPU utilisation is averaged over this sample on every tick. */
    private static final Duration CPU_SAMPLE = Duration.ofMillis(100);

    @Bean
    public Clock guardianClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper guardianSleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public SystemInfo systemInfo() {
        return new SystemInfo();
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public BackendProcessMatcher backendProcessMatcher(KillSequenceProperties props) {
        return new BackendProcessMatcher(props.getBackendExecutable(), props.getServeSubcommand());
    }

    @Bean
    public BackendProcessController backendProcessController(BackendProcessMatcher matcher,
                                                             ProcessFactory processFactory,
                                                             KillSequenceProperties props) {
        return new OsBackendProcessController(matcher, processFactory, props.getLaunchCommand());
    }

    @Bean
    public PidFile backendPidFile(KillSequenceProperties props) {
        return new PidFile(Path.of(props.getPidFile()));
    }

    @Bean
    public RestClient servingRestClient(RestClient.Builder builder, ServingApiProperties props) {
        LOG.info("Serving API at {} (timeout {}ms)", props.baseUrl(), props.timeout().toMillis());
        return builder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props.timeout()))
                .build();
    }

    @Bean
    public RestClient backendRestClient(RestClient.Builder builder, InferenceBackendProperties props) {
        LOG.info("Inference backend at {} (timeout {}ms)", props.baseUrl(), props.timeout().toMillis());
        return builder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props.timeout()))
                .build();
    }

    @Bean
    public ServingApiClient servingApiClient(@Qualifier("servingRestClient") RestClient restClient) {
        return new HttpServingApiClient(restClient);
    }

    @Bean
    public InferenceBackendClient inferenceBackendClient(@Qualifier("backendRestClient") RestClient restClient,
                                                         InferenceBackendProperties props) {
        return new HttpInferenceBackendClient(restClient, props);
    }

    @Bean
    public MetricsCollector metricsCollector(SystemInfo systemInfo,
                                             BackendProcessController processController,
                                             Clock clock) {
        return new OshiMetricsCollector(systemInfo, processController, clock, CPU_SAMPLE);
    }

    @Bean
    public BrownoutManager brownoutManager(ServingApiClient serving,
                                           BrownoutProperties props,
                                           GuardianMetrics metrics,
                                           Clock clock) {
        return new BrownoutManager(serving, props, metrics, clock);
    }

    @Bean
    public GracefulKillSequence gracefulKillSequence(ServingApiClient serving,
                                                     BackendProcessController processController,
                                                     InferenceBackendClient backend,
                                                     PidFile pidFile,
                                                     KillSequenceProperties props,
                                                     Sleeper sleeper,
                                                     Clock clock) {
        return new GracefulKillSequence(serving, processController, backend, pidFile, props, sleeper, clock);
    }

    @Bean
    public GuardianControlLoop guardianControlLoop(GuardianProperties props,
                                                   MetricsCollector collector,
                                                   BrownoutManager brownout,
                                                   GracefulKillSequence killSequence,
                                                   GuardianMetrics metrics,
                                                   ApplicationEventPublisher publisher,
                                                   Clock clock) {
        return new GuardianControlLoop(props, collector, brownout, killSequence, metrics, publisher, clock);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
