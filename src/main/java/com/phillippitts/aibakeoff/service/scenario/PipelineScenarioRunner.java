package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.domain.BenchmarkInputs;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter;
import com.phillippitts.aibakeoff.service.provider.SpeechResult;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import com.phillippitts.aibakeoff.util.Timed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Benchmarks translation chained into speech synthesis of the translated text.
 *
 * <p>Each chain produces one record tagged with both providers. Its latency is the sum of
 * the two step durations; waiting for a nested limiter slot between the steps is not counted.
 * A failure in either step fails the whole chain.
 *
 * <p>The secondary chain runs only when both secondary providers are configured. Its
 * synthesis step holds a slot of the shared ElevenLabs limiter.
 */
@Component
public class PipelineScenarioRunner extends AbstractScenarioRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineScenarioRunner.class);

    private final TranslationProvider primaryTranslation;
    private final SpeechSynthesisProvider primarySpeech;
    private final TranslationProvider secondaryTranslation;
    private final SpeechSynthesisProvider secondarySpeech;
    private final ConcurrencyLimiter secondaryLimiter;
    private final BenchmarkInputs inputs;
    private final ConcurrencyProperties concurrency;

    public PipelineScenarioRunner(@Qualifier("groqTranslationProvider") TranslationProvider primaryTranslation,
                                  @Qualifier("grokSpeechProvider") SpeechSynthesisProvider primarySpeech,
                                  @Qualifier("openAiTranslationProvider") TranslationProvider secondaryTranslation,
                                  @Qualifier("elevenLabsSpeechProvider") SpeechSynthesisProvider secondarySpeech,
                                  @Qualifier("elevenLabsLimiter") ConcurrencyLimiter secondaryLimiter,
                                  BenchmarkInputs inputs,
                                  ConcurrencyProperties concurrency,
                                  ScenarioDependencies deps) {
        super(deps);
        this.primaryTranslation = Objects.requireNonNull(primaryTranslation, "primaryTranslation");
        this.primarySpeech = Objects.requireNonNull(primarySpeech, "primarySpeech");
        this.secondaryTranslation = Objects.requireNonNull(secondaryTranslation, "secondaryTranslation");
        this.secondarySpeech = Objects.requireNonNull(secondarySpeech, "secondarySpeech");
        this.secondaryLimiter = Objects.requireNonNull(secondaryLimiter, "secondaryLimiter");
        this.inputs = Objects.requireNonNull(inputs, "inputs");
        this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
    }

    @Override
    public Scenario scenario() {
        return Scenario.PIPELINE;
    }

    @Override
    public List<MeasurementRecord> run() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("pipeline", concurrency.getTtsMax());
        boolean secondaryReady = secondaryTranslation.isConfigured() && secondarySpeech.isConfigured();
        ConcurrencyLimiter nested = secondaryReady ? secondaryLimiter : null;
        if (!secondaryReady) {
            LOG.info("Secondary pipeline {}+{} not fully configured; skipping it",
                    secondaryTranslation.provider().tag(), secondarySpeech.provider().tag());
        }
        return dispatch(inputs.translationPairs(), limiter, pair -> chainWithAll(pair, nested));
    }

    private List<MeasurementRecord> chainWithAll(TranslationPair pair, ConcurrencyLimiter speechLimiter) {
        List<MeasurementRecord> records = new ArrayList<>(2);
        records.add(chain(primaryTranslation, primarySpeech, pair, null));
        if (speechLimiter != null) {
            records.add(chain(secondaryTranslation, secondarySpeech, pair, speechLimiter));
        }
        return records;
    }

    /**
     * Runs one translate-then-speak chain.
     *
     * @param speechLimiter nested limiter held during synthesis only, or {@code null}
     */
    MeasurementRecord chain(TranslationProvider translator,
                            SpeechSynthesisProvider speaker,
                            TranslationPair pair,
                            ConcurrencyLimiter speechLimiter) {
        ProviderTag tag = ProviderTag.paired(translator.provider(), speaker.provider());
        ThreadContext.put("provider", tag.label());
        try {
            Timed<TranslationResult> translated = timed(() -> translator.translate(pair));
            String text = translated.value().text();
            Timed<SpeechResult> spoken = speechLimiter == null
                    ? timed(() -> speaker.synthesize(text, pair.target()))
                    : speechLimiter.run(() -> timed(() -> speaker.synthesize(text, pair.target())));
            return recorded(MeasurementRecord.success(tag, scenario(), pair.languageLabel(),
                    translated.elapsedMs() + spoken.elapsedMs(),
                    translated.value().totalTokens(),
                    spoken.value().audioBytes()));
        } catch (RuntimeException e) {
            return failed(tag, pair.languageLabel(), e);
        } finally {
            ThreadContext.remove("provider");
        }
    }
}
