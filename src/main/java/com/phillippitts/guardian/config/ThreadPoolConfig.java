package com.phillippitts.guardian.config;

import com.phillippitts.guardian.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Executor for the guardian control loop.
 *
 * <p>Exactly one thread: ticks must run sequentially and the loop is the single writer of
 * guardian state. Shutdown waits for the running task instead of interrupting it, so a kill
 * sequence in progress always completes.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-thread executor running the guardian daemon loop.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread to the loop
     * thread so startup correlation values appear in loop logs.
     *
     * @return executor dedicated to the control loop
     */
    @Bean(name = "guardianLoopExecutor")
    public Executor guardianLoopExecutor() {
        ThreadPoolProperties.LoopPoolProperties loopProps = threadPoolProperties.getLoop();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix(loopProps.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(loopProps.getAwaitTerminationSeconds());

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
