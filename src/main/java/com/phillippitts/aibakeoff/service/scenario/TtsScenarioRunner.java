package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.domain.BenchmarkInputs;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.TtsPrompt;
import com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Benchmarks speech synthesis for every seed prompt.
 *
 * <p>The streaming provider runs under the scenario limiter only. The REST provider, when
 * configured, additionally holds a slot of the shared ElevenLabs limiter for the duration of
 * each call. That limiter is the same instance the pipeline uses, so the per-account ceiling
 * holds even when both scenarios run at once.
 */
@Component
public class TtsScenarioRunner extends AbstractScenarioRunner {

    private static final Logger LOG = LogManager.getLogger(TtsScenarioRunner.class);

    private final SpeechSynthesisProvider primary;
    private final SpeechSynthesisProvider secondary;
    private final ConcurrencyLimiter secondaryLimiter;
    private final BenchmarkInputs inputs;
    private final ConcurrencyProperties concurrency;

    public TtsScenarioRunner(@Qualifier("grokSpeechProvider") SpeechSynthesisProvider primary,
                             @Qualifier("elevenLabsSpeechProvider") SpeechSynthesisProvider secondary,
                             @Qualifier("elevenLabsLimiter") ConcurrencyLimiter secondaryLimiter,
                             BenchmarkInputs inputs,
                             ConcurrencyProperties concurrency,
                             ScenarioDependencies deps) {
        super(deps);
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        this.secondaryLimiter = Objects.requireNonNull(secondaryLimiter, "secondaryLimiter");
        this.inputs = Objects.requireNonNull(inputs, "inputs");
        this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
    }

    @Override
    public Scenario scenario() {
        return Scenario.TTS;
    }

    @Override
    public List<MeasurementRecord> run() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("tts", concurrency.getTtsMax());
        ConcurrencyLimiter nested = secondary.isConfigured() ? secondaryLimiter : null;
        if (nested == null) {
            LOG.info("{} not configured; tts scenario runs {} only",
                    secondary.provider().displayName(), primary.provider().displayName());
        }
        return dispatch(inputs.ttsPrompts(), limiter, prompt -> synthesizeWithAll(prompt, nested));
    }

    private List<MeasurementRecord> synthesizeWithAll(TtsPrompt prompt, ConcurrencyLimiter speechLimiter) {
        List<MeasurementRecord> records = new ArrayList<>(2);
        records.add(measureSynthesis(primary, prompt.text(), prompt.language(), null));
        if (speechLimiter != null) {
            records.add(measureSynthesis(secondary, prompt.text(), prompt.language(), speechLimiter));
        }
        return records;
    }
}
