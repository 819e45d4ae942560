package com.phillippitts.aibakeoff.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the benchmark task executor, the scenario driver executor
 * and the realtime-session deadline scheduler.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties benchmark = new PoolProperties(20, 40, 200, "bench-pool-");
    private PoolProperties scenario = new PoolProperties(3, 3, 0, "scenario-");
    private DeadlinePoolProperties deadline = new DeadlinePoolProperties();

    public PoolProperties getBenchmark() {
        return benchmark;
    }

    public void setBenchmark(PoolProperties benchmark) {
        this.benchmark = benchmark;
    }

    public PoolProperties getScenario() {
        return scenario;
    }

    public void setScenario(PoolProperties scenario) {
        this.scenario = scenario;
    }

    public DeadlinePoolProperties getDeadline() {
        return deadline;
    }

    public void setDeadline(DeadlinePoolProperties deadline) {
        this.deadline = deadline;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        public PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Scheduler that fires realtime-session deadlines.
     */
    public static class DeadlinePoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "ws-deadline-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
