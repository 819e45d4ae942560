package com.phillippitts.aibakeoff.service.report;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders the human-readable summary table and error list printed at the end of a run.
 */
@Component
public class SummaryTableFormatter {

    static final String HEADER = "Summary (p50/p95 ms, ok rate):";
    static final String ERRORS_HEADER = "Errors:";

    private static final String ROW_FORMAT = "  %-18s %-18s p50=%5.0f p95=%5.0f ok=%6s avgBytes=%s";

    /**
     * Formats the summary rows followed, if any record failed, by the error section.
     */
    public String format(BakeoffReport report) {
        StringBuilder out = new StringBuilder(HEADER);
        for (SummaryRow row : report.summary()) {
            out.append(System.lineSeparator()).append(formatRow(row));
        }
        List<MeasurementRecord> failures = report.failures();
        if (!failures.isEmpty()) {
            out.append(System.lineSeparator()).append(System.lineSeparator()).append(ERRORS_HEADER);
            for (MeasurementRecord failure : failures) {
                out.append(System.lineSeparator()).append(formatError(failure));
            }
        }
        return out.toString();
    }

    String formatRow(SummaryRow row) {
        String okRate = String.format(Locale.ROOT, "%.1f%%", row.okRate() * 100.0);
        Double avg = row.avgAudioBytes();
        String bytes = avg == null || avg == 0.0 ? "-" : Math.round(avg) + " bytes";
        return String.format(Locale.ROOT, ROW_FORMAT,
                row.scenario().label(), row.provider().label(), row.p50(), row.p95(), okRate, bytes);
    }

    String formatError(MeasurementRecord record) {
        return "  [" + record.provider().label() + "][" + record.scenario().label() + "]["
                + record.language() + "] " + record.errorMessage();
    }
}
