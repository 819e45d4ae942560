package com.phillippitts.aibakeoff.service.metrics;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.util.TimeUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized Micrometer instrumentation for provider calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency per provider and scenario (successful calls only)</li>
 *   <li>Success/failure counts per provider and scenario</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class BenchmarkMetrics {

    private static final String METRIC_PREFIX = "bakeoff.provider";

    private final MeterRegistry registry;

    public BenchmarkMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one measurement: latency and success count when ok, failure count otherwise.
     *
     * @param record measurement to record
     */
    public void record(MeasurementRecord record) {
        String provider = record.provider().label();
        String scenario = record.scenario().label();
        if (record.ok()) {
            Timer.builder(METRIC_PREFIX + ".latency")
                    .description("Provider call latency")
                    .tag("provider", provider)
                    .tag("scenario", scenario)
                    .register(registry)
                    .record(TimeUtils.millisToNanos(record.elapsedMs()), TimeUnit.NANOSECONDS);
            Counter.builder(METRIC_PREFIX + ".success")
                    .description("Number of successful provider calls")
                    .tag("provider", provider)
                    .tag("scenario", scenario)
                    .register(registry)
                    .increment();
        } else {
            Counter.builder(METRIC_PREFIX + ".failure")
                    .description("Number of failed provider calls")
                    .tag("provider", provider)
                    .tag("scenario", scenario)
                    .register(registry)
                    .increment();
        }
    }
}
