package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.service.metrics.BenchmarkMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.LongSupplier;

/**
 * Groups the collaborators every scenario runner needs for cleaner constructor injection.
 */
@Component
public final class ScenarioDependencies {
    private final Executor executor;
    private final BenchmarkMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier ticker;

    @Autowired
    public ScenarioDependencies(@Qualifier("benchmarkExecutor") Executor executor,
                                BenchmarkMetrics metrics,
                                ApplicationEventPublisher publisher) {
        this(executor, metrics, publisher, System::nanoTime);
    }

    /**
     * @param executor pool the per-input tasks are dispatched on
     * @param metrics Micrometer recorder
     * @param publisher failure event publisher (nullable)
     * @param ticker monotonic nanosecond source used for timing
     */
    public ScenarioDependencies(Executor executor,
                                BenchmarkMetrics metrics,
                                ApplicationEventPublisher publisher,
                                LongSupplier ticker) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    public Executor getExecutor() {
        return executor;
    }

    public BenchmarkMetrics getMetrics() {
        return metrics;
    }

    public ApplicationEventPublisher getPublisher() {
        return publisher;
    }

    public LongSupplier getTicker() {
        return ticker;
    }
}
