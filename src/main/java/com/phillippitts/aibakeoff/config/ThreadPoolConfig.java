package com.phillippitts.aibakeoff.config;

import com.phillippitts.aibakeoff.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the benchmark.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor the scenario runners dispatch their per-input tasks on.
     *
     * <p>Pool sizing via {@code threadpool.benchmark.*}:
     * <ul>
     *   <li>Core pool: default 20 - one thread per TTS slot</li>
     *   <li>Max pool: default 40 - headroom when scenarios run in parallel</li>
     *   <li>Queue: default 200 tasks</li>
     * </ul>
     *
     * <p>Admission is governed by the runners' limiters, not by the pool size. A task that
     * waits for a limiter slot holds its worker thread while it waits.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue
     * are full the dispatching thread runs the task itself.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the dispatching thread is copied to
     * the worker.
     *
     * @return executor for benchmark tasks
     */
    @Bean(name = "benchmarkExecutor")
    public Executor benchmarkExecutor() {
        return buildExecutor(threadPoolProperties.getBenchmark());
    }

    /**
     * Executor that drives whole scenarios when {@code bakeoff.run.parallel-scenarios=true}.
     * Kept apart from {@link #benchmarkExecutor()} so scenario drivers never occupy the
     * threads their own tasks need.
     */
    @Bean(name = "scenarioExecutor")
    public Executor scenarioExecutor() {
        return buildExecutor(threadPoolProperties.getScenario());
    }

    /**
     * Scheduler that fires realtime speech session deadlines.
     */
    @Bean(name = "realtimeDeadlineScheduler")
    public ThreadPoolTaskScheduler realtimeDeadlineScheduler() {
        ThreadPoolProperties.DeadlinePoolProperties props = threadPoolProperties.getDeadline();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
