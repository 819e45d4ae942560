package com.phillippitts.aibakeoff.service.report;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.SummaryRow;

import java.util.List;

/**
 * Outcome of one bakeoff run: the aggregated table and every raw record behind it.
 *
 * @param summary one row per (provider, scenario) in first-seen order
 * @param records all measurements in scenario order
 */
public record BakeoffReport(List<SummaryRow> summary, List<MeasurementRecord> records) {

    public BakeoffReport {
        summary = summary == null ? List.of() : List.copyOf(summary);
        records = records == null ? List.of() : List.copyOf(records);
    }

    /**
     * Returns the failed records in their original order.
     */
    public List<MeasurementRecord> failures() {
        return records.stream().filter(r -> !r.ok()).toList();
    }
}
