package com.phillippitts.guardian.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the control-loop executor.
 *
 * <p>The loop runs on exactly one thread; only naming and shutdown timing are tuneable.
 * The shutdown wait must cover a full kill sequence, which is never cancelled.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private LoopPoolProperties loop = new LoopPoolProperties();

    public LoopPoolProperties getLoop() {
        return loop;
    }

    public void setLoop(LoopPoolProperties loop) {
        this.loop = loop;
    }

    /**
     * Guardian loop executor configuration.
     */
    public static class LoopPoolProperties {
        private String threadNamePrefix = "guardian-loop-";
        private int awaitTerminationSeconds = 180;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
