package com.phillippitts.aibakeoff.service.scenario;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Scenario;

import java.util.List;

/**
 * One benchmark mode: fans its inputs out under a concurrency limiter and returns the
 * measurements once every task has settled.
 */
public interface ScenarioRunner {

    Scenario scenario();

    /**
     * Runs the scenario to completion.
     *
     * <p>Provider failures never propagate; each becomes a failed record. Providers without
     * a credential contribute no records at all.
     *
     * @return every record produced, immutable
     */
    List<MeasurementRecord> run();
}
