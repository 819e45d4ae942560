package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.domain.BenchmarkInputs;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter;
import com.phillippitts.aibakeoff.service.provider.TranslationProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Benchmarks chat-completion translation across every seed language pair.
 *
 * <p>The primary provider is always called. The secondary provider is called for the same
 * pair only when its credential is present, and is timed independently.
 */
@Component
public class TranslationScenarioRunner extends AbstractScenarioRunner {

    private static final Logger LOG = LogManager.getLogger(TranslationScenarioRunner.class);

    private final TranslationProvider primary;
    private final TranslationProvider secondary;
    private final BenchmarkInputs inputs;
    private final ConcurrencyProperties concurrency;

    public TranslationScenarioRunner(@Qualifier("groqTranslationProvider") TranslationProvider primary,
                                     @Qualifier("openAiTranslationProvider") TranslationProvider secondary,
                                     BenchmarkInputs inputs,
                                     ConcurrencyProperties concurrency,
                                     ScenarioDependencies deps) {
        super(deps);
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        this.inputs = Objects.requireNonNull(inputs, "inputs");
        this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
    }

    @Override
    public Scenario scenario() {
        return Scenario.TRANSLATION;
    }

    @Override
    public List<MeasurementRecord> run() {
        boolean withSecondary = secondary.isConfigured();
        if (!withSecondary) {
            LOG.info("{} not configured; translation scenario runs {} only",
                    secondary.provider().displayName(), primary.provider().displayName());
        }
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("translation", concurrency.getTranslationMax());
        return dispatch(inputs.translationPairs(), limiter, pair -> translateWithAll(pair, withSecondary));
    }

    private List<MeasurementRecord> translateWithAll(TranslationPair pair, boolean withSecondary) {
        List<MeasurementRecord> records = new ArrayList<>(2);
        records.add(measureTranslation(primary, pair));
        if (withSecondary) {
            records.add(measureTranslation(secondary, pair));
        }
        return records;
    }
}
