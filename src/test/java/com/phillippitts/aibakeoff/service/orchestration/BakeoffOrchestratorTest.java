package com.phillippitts.aibakeoff.service.orchestration;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.config.properties.ReportProperties;
import com.phillippitts.aibakeoff.config.properties.RunProperties;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.exception.BakeoffException;
import com.phillippitts.aibakeoff.service.metrics.MetricsAggregator;
import com.phillippitts.aibakeoff.service.report.BakeoffReport;
import com.phillippitts.aibakeoff.service.report.JsonReportWriter;
import com.phillippitts.aibakeoff.service.report.SummaryTableFormatter;
import com.phillippitts.aibakeoff.service.scenario.ScenarioRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BakeoffOrchestratorTest {

    @TempDir
    Path tempDir;

    private final ExecutorService scenarioPool = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        scenarioPool.shutdownNow();
    }

    @Test
    void runsScenariosInOrderAndWritesReport() {
        BakeoffOrchestrator orchestrator = orchestrator(false,
                stub(Scenario.PIPELINE, () -> List.of(record(ProviderTag.paired(Provider.GROQ, Provider.GROK),
                        Scenario.PIPELINE))),
                stub(Scenario.TRANSLATION, () -> List.of(record(ProviderTag.of(Provider.GROQ), Scenario.TRANSLATION))),
                stub(Scenario.TTS, () -> List.of(
                        record(ProviderTag.of(Provider.GROK), Scenario.TTS),
                        MeasurementRecord.failure(ProviderTag.of(Provider.GROK), Scenario.TTS, "ar", "boom"))));

        assertThat(orchestrator.runners()).extracting(ScenarioRunner::scenario)
                .containsExactly(Scenario.TRANSLATION, Scenario.TTS, Scenario.PIPELINE);

        BakeoffReport report = orchestrator.run();

        assertThat(report.records()).extracting(MeasurementRecord::scenario)
                .containsExactly(Scenario.TRANSLATION, Scenario.TTS, Scenario.TTS, Scenario.PIPELINE);
        assertThat(report.summary()).extracting(r -> r.provider().label())
                .containsExactly("groq", "grok", "groq+grok");
        assertThat(report.summary().get(1).okRate()).isEqualTo(0.5);
        assertThat(report.failures()).hasSize(1);
        assertThat(Files.exists(tempDir.resolve("ai-bakeoff-report.json"))).isTrue();
    }

    @Test
    void parallelModeKeepsScenarioOrder() {
        BakeoffOrchestrator orchestrator = orchestrator(true,
                stub(Scenario.TRANSLATION, () -> {
                    sleep(100);
                    return List.of(record(ProviderTag.of(Provider.GROQ), Scenario.TRANSLATION));
                }),
                stub(Scenario.TTS, () -> List.of(record(ProviderTag.of(Provider.GROK), Scenario.TTS))),
                stub(Scenario.PIPELINE, () -> List.of(record(ProviderTag.paired(Provider.GROQ, Provider.GROK),
                        Scenario.PIPELINE))));

        BakeoffReport report = orchestrator.run();

        assertThat(report.records()).extracting(MeasurementRecord::scenario)
                .containsExactly(Scenario.TRANSLATION, Scenario.TTS, Scenario.PIPELINE);
    }

    @Test
    void scenarioAbortPropagates() {
        BakeoffOrchestrator orchestrator = orchestrator(false,
                stub(Scenario.TRANSLATION, () -> {
                    throw new BakeoffException("translation scenario aborted: interrupted");
                }));

        assertThatThrownBy(orchestrator::run)
                .isInstanceOf(BakeoffException.class)
                .hasMessageContaining("aborted");
    }

    @Test
    void scenarioAbortPropagatesInParallelMode() {
        BakeoffOrchestrator orchestrator = orchestrator(true,
                stub(Scenario.TTS, () -> {
                    throw new IllegalStateException("pool shut down");
                }));

        assertThatThrownBy(orchestrator::run)
                .isInstanceOf(BakeoffException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private BakeoffOrchestrator orchestrator(boolean parallel, ScenarioRunner... runners) {
        return new BakeoffOrchestrator(List.of(runners), new MetricsAggregator(),
                new JsonReportWriter(new ReportProperties(tempDir)), new SummaryTableFormatter(),
                new ConcurrencyProperties(), new RunProperties(true, parallel), scenarioPool);
    }

    private static ScenarioRunner stub(Scenario scenario, Supplier<List<MeasurementRecord>> records) {
        return new ScenarioRunner() {
            @Override
            public Scenario scenario() {
                return scenario;
            }

            @Override
            public List<MeasurementRecord> run() {
                return records.get();
            }
        };
    }

    private static MeasurementRecord record(ProviderTag tag, Scenario scenario) {
        return MeasurementRecord.success(tag, scenario, "en", 100, null, null);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
