package com.phillippitts.aibakeoff.service.orchestration;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.config.properties.RunProperties;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import com.phillippitts.aibakeoff.exception.BakeoffException;
import com.phillippitts.aibakeoff.service.metrics.MetricsAggregator;
import com.phillippitts.aibakeoff.service.report.BakeoffReport;
import com.phillippitts.aibakeoff.service.report.JsonReportWriter;
import com.phillippitts.aibakeoff.service.report.SummaryTableFormatter;
import com.phillippitts.aibakeoff.service.scenario.ScenarioRunner;
import com.phillippitts.aibakeoff.util.Timed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives one complete bakeoff: runs every scenario, aggregates the records, writes the JSON
 * report and logs the summary table.
 *
 * <p><b>Scenario order:</b> translation, then TTS, then pipeline. By default each scenario
 * finishes before the next starts. With {@code bakeoff.run.parallel-scenarios=true} they run
 * concurrently on the scenario executor; records are still merged in scenario order.
 *
 * <p><b>Error Handling:</b> provider failures arrive as failed records and never abort the
 * run. Anything else (an interrupted dispatch, an unwritable report directory) propagates as
 * a {@link BakeoffException}.
 */
@Service
public class BakeoffOrchestrator {

    private static final Logger LOG = LogManager.getLogger(BakeoffOrchestrator.class);

    private final List<ScenarioRunner> runners;
    private final MetricsAggregator aggregator;
    private final JsonReportWriter reportWriter;
    private final SummaryTableFormatter formatter;
    private final ConcurrencyProperties concurrency;
    private final RunProperties runProperties;
    private final Executor scenarioExecutor;

    public BakeoffOrchestrator(List<ScenarioRunner> runners,
                               MetricsAggregator aggregator,
                               JsonReportWriter reportWriter,
                               SummaryTableFormatter formatter,
                               ConcurrencyProperties concurrency,
                               RunProperties runProperties,
                               @Qualifier("scenarioExecutor") Executor scenarioExecutor) {
        Objects.requireNonNull(runners, "runners");
        List<ScenarioRunner> ordered = new ArrayList<>(runners);
        ordered.sort(Comparator.comparing(ScenarioRunner::scenario));
        this.runners = List.copyOf(ordered);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
        this.runProperties = Objects.requireNonNull(runProperties, "runProperties");
        this.scenarioExecutor = Objects.requireNonNull(scenarioExecutor, "scenarioExecutor");
    }

    /**
     * Runs the bakeoff to completion.
     *
     * @return the summary and every record
     * @throws BakeoffException if a scenario aborts or the report cannot be written
     */
    public BakeoffReport run() {
        LOG.info("Running AI bakeoff ({} scenarios)", runners.size());
        LOG.info("Concurrency: LLM {} / TTS {} / ElevenLabs {}", concurrency.getTranslationMax(),
                concurrency.getTtsMax(), concurrency.getElevenlabsMax());

        List<MeasurementRecord> records = runProperties.isParallelScenarios()
                ? runConcurrently()
                : runSequentially();

        List<SummaryRow> summary = aggregator.summarize(records);
        BakeoffReport report = new BakeoffReport(summary, records);
        Path path = reportWriter.write(report);

        LOG.info("{}{}", System.lineSeparator(), formatter.format(report));
        LOG.info("Report saved to: {}", path.toAbsolutePath());
        return report;
    }

    List<ScenarioRunner> runners() {
        return runners;
    }

    private List<MeasurementRecord> runSequentially() {
        List<MeasurementRecord> all = new ArrayList<>();
        for (ScenarioRunner runner : runners) {
            all.addAll(runScenario(runner));
        }
        return all;
    }

    private List<MeasurementRecord> runConcurrently() {
        List<CompletableFuture<List<MeasurementRecord>>> futures = new ArrayList<>(runners.size());
        for (ScenarioRunner runner : runners) {
            futures.add(CompletableFuture.supplyAsync(() -> runScenario(runner), scenarioExecutor));
        }
        List<MeasurementRecord> all = new ArrayList<>();
        try {
            for (CompletableFuture<List<MeasurementRecord>> future : futures) {
                all.addAll(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof BakeoffException be) {
                throw be;
            }
            throw new BakeoffException("Scenario failed: " + e.getCause(), e.getCause());
        }
        return all;
    }

    private List<MeasurementRecord> runScenario(ScenarioRunner runner) {
        Timed<List<MeasurementRecord>> timed = Timed.measure(runner::run);
        LOG.info("Scenario {} produced {} records in {} ms", runner.scenario().label(), timed.value().size(),
                Math.round(timed.elapsedMs()));
        return timed.value();
    }
}
