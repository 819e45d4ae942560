package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.exception.BakeoffException;
import com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter;
import com.phillippitts.aibakeoff.service.events.ProviderFailureEvent;
import com.phillippitts.aibakeoff.service.provider.SpeechResult;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import com.phillippitts.aibakeoff.util.Timed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for scenario runners providing task dispatch, timing and failure conversion.
 *
 * <p><b>Dispatch:</b> {@link #dispatch} acquires a limiter slot on the calling thread for each
 * input in loop order, then submits that input's task to the benchmark executor. The task
 * releases the slot when it finishes. Slot requests therefore follow input order regardless
 * of how the executor schedules its threads; completion order is unconstrained.
 *
 * <p><b>Failure isolation:</b> subclasses time provider calls with {@link #timed} inside a
 * try block and hand any {@link RuntimeException} to {@link #failed}, which turns it into a
 * failed record. A failing call never affects sibling calls or other inputs.
 *
 * <p>Every record passes through {@link #recorded}, which feeds Micrometer and publishes a
 * {@link ProviderFailureEvent} for failures.
 *
 * @since 1.0
 */
public abstract class AbstractScenarioRunner implements ScenarioRunner {

    private static final Logger LOG = LogManager.getLogger(AbstractScenarioRunner.class);

    protected final ScenarioDependencies deps;

    protected AbstractScenarioRunner(ScenarioDependencies deps) {
        this.deps = Objects.requireNonNull(deps, "deps");
    }

    /**
     * Runs {@code task} for every input concurrently, each under one slot of {@code limiter}.
     * Blocks the caller while the limiter is saturated.
     *
     * @param inputs inputs in dispatch order
     * @param limiter scenario-wide limiter
     * @param task per-input work returning that input's records
     * @return all records, grouped by input in dispatch order
     * @throws BakeoffException if a task fails outside the provider-call boundary, the
     *         limiter wait is interrupted, or the executor rejects a task
     */
    protected <I> List<MeasurementRecord> dispatch(List<I> inputs,
                                                   ConcurrencyLimiter limiter,
                                                   Function<I, List<MeasurementRecord>> task) {
        String scenarioLabel = scenario().label();
        List<CompletableFuture<List<MeasurementRecord>>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            // Slots are requested here, in input order, before the task reaches the executor
            limiter.acquire();
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    ThreadContext.put("scenario", scenarioLabel);
                    try {
                        return task.apply(input);
                    } finally {
                        ThreadContext.remove("scenario");
                        limiter.release();
                    }
                }, deps.getExecutor()));
            } catch (RejectedExecutionException e) {
                limiter.release();
                throw new BakeoffException(scenarioLabel + " scenario aborted: task rejected by executor", e);
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BakeoffException(scenarioLabel + " scenario aborted: " + cause.getMessage(), cause);
        }

        List<MeasurementRecord> all = new ArrayList<>();
        for (CompletableFuture<List<MeasurementRecord>> future : futures) {
            all.addAll(future.join());
        }
        LOG.info("{} scenario finished: {} inputs, {} records", scenarioLabel, inputs.size(), all.size());
        return List.copyOf(all);
    }

    /**
     * Times {@code operation} with the configured ticker.
     */
    protected <T> Timed<T> timed(Supplier<T> operation) {
        return Timed.measure(deps.getTicker(), operation);
    }

    /**
     * Translates {@code pair} and returns a record for this scenario.
     */
    protected MeasurementRecord measureTranslation(TranslationProvider provider, TranslationPair pair) {
        ProviderTag tag = ProviderTag.of(provider.provider());
        ThreadContext.put("provider", tag.label());
        try {
            Timed<TranslationResult> t = timed(() -> provider.translate(pair));
            return recorded(MeasurementRecord.success(tag, scenario(), pair.languageLabel(),
                    t.elapsedMs(), t.value().totalTokens(), null));
        } catch (RuntimeException e) {
            return failed(tag, pair.languageLabel(), e);
        } finally {
            ThreadContext.remove("provider");
        }
    }

    /**
     * Synthesizes {@code text}, optionally under a nested provider limiter, and returns a
     * record for this scenario. Time spent waiting for the nested slot is not measured.
     *
     * @param providerLimiter narrower limiter for rate-sensitive providers, or {@code null}
     */
    protected MeasurementRecord measureSynthesis(SpeechSynthesisProvider provider,
                                                 String text,
                                                 String language,
                                                 ConcurrencyLimiter providerLimiter) {
        ProviderTag tag = ProviderTag.of(provider.provider());
        ThreadContext.put("provider", tag.label());
        try {
            Supplier<Timed<SpeechResult>> call = () -> timed(() -> provider.synthesize(text, language));
            Timed<SpeechResult> t = providerLimiter == null ? call.get() : providerLimiter.run(call);
            return recorded(MeasurementRecord.success(tag, scenario(), language,
                    t.elapsedMs(), null, t.value().audioBytes()));
        } catch (RuntimeException e) {
            return failed(tag, language, e);
        } finally {
            ThreadContext.remove("provider");
        }
    }

    /**
     * Converts a provider failure into a failed record.
     */
    protected MeasurementRecord failed(ProviderTag provider, String language, RuntimeException error) {
        String message = error.getMessage() == null ? error.toString() : error.getMessage();
        return recorded(MeasurementRecord.failure(provider, scenario(), language, message));
    }

    /**
     * Reports {@code record} to metrics and, if failed, to the failure event stream.
     */
    protected MeasurementRecord recorded(MeasurementRecord record) {
        deps.getMetrics().record(record);
        if (record.ok()) {
            LOG.debug("{} [{}] {} ok in {} ms", record.scenario().label(), record.language(),
                    record.provider().label(), String.format("%.1f", record.elapsedMs()));
        } else if (deps.getPublisher() != null) {
            deps.getPublisher().publishEvent(new ProviderFailureEvent(record.provider().label(),
                    record.scenario().label(), record.language(), Instant.now(), record.errorMessage()));
        }
        return record;
    }
}
