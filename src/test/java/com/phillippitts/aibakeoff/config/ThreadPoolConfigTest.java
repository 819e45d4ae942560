package com.phillippitts.aibakeoff.config;

import com.phillippitts.aibakeoff.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateBenchmarkExecutorWithDefaults() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.benchmarkExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(20);
            assertThat(executor.getMaxPoolSize()).isEqualTo(40);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("bench-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.benchmarkExecutor();
        try {
            AtomicReference<String> seen = new AtomicReference<>();
            AtomicReference<String> thread = new AtomicReference<>();
            CountDownLatch latch = new CountDownLatch(1);
            ThreadContext.put("scenario", "tts");

            executor.execute(() -> {
                seen.set(ThreadContext.get("scenario"));
                thread.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("tts");
            assertThat(thread.get()).startsWith("bench-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() -> ThreadContext.put("provider", "grok"));
        ThreadContext.put("scenario", "pipeline");
        Runnable again = ThreadPoolConfig.mdcPropagating().decorate(() -> { });
        ThreadContext.clearAll();

        decorated.run();
        assertThat(ThreadContext.get("provider")).isNull();
        again.run();
        assertThat(ThreadContext.get("scenario")).isNull();
    }

    @Test
    void shouldCreateDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = config.realtimeDeadlineScheduler();
        try {
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("ws-deadline-");
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(2);
        } finally {
            scheduler.shutdown();
        }
    }
}
