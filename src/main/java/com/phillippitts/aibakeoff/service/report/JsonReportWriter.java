package com.phillippitts.aibakeoff.service.report;

import com.phillippitts.aibakeoff.config.properties.ReportProperties;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import com.phillippitts.aibakeoff.exception.BakeoffException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Persists a {@link BakeoffReport} as pretty-printed JSON.
 *
 * <p>Layout: {@code {"summary": [...], "samples": [...]}}. Optional fields
 * ({@code costTokens}, {@code audioBytes}, {@code error}, {@code avgAudioBytes}) are omitted
 * when absent. The output directory is created if missing and an existing file is replaced.
 */
@Component
public class JsonReportWriter {

    private static final Logger LOG = LogManager.getLogger(JsonReportWriter.class);
    private static final int INDENT = 2;

    private final ReportProperties properties;

    public JsonReportWriter(ReportProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Writes {@code report} to the configured report path.
     *
     * @return the path written
     * @throws BakeoffException if the directory or file cannot be written
     */
    public Path write(BakeoffReport report) {
        Objects.requireNonNull(report, "report");
        Path target = properties.reportPath();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(report).toString(INDENT), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BakeoffException("Failed to write report to " + target, e);
        }
        LOG.debug("Wrote {} summary rows and {} samples to {}",
                report.summary().size(), report.records().size(), target);
        return target;
    }

    static JSONObject toJson(BakeoffReport report) {
        JSONArray summary = new JSONArray();
        for (SummaryRow row : report.summary()) {
            summary.put(toJson(row));
        }
        JSONArray samples = new JSONArray();
        for (MeasurementRecord record : report.records()) {
            samples.put(toJson(record));
        }
        return new JSONObject()
                .put("summary", summary)
                .put("samples", samples);
    }

    private static JSONObject toJson(SummaryRow row) {
        JSONObject json = new JSONObject()
                .put("provider", row.provider().label())
                .put("scenario", row.scenario().label())
                .put("p50", row.p50())
                .put("p95", row.p95())
                .put("okRate", row.okRate());
        // putOpt skips null values
        json.putOpt("avgAudioBytes", row.avgAudioBytes());
        return json;
    }

    private static JSONObject toJson(MeasurementRecord record) {
        JSONObject json = new JSONObject()
                .put("provider", record.provider().label())
                .put("scenario", record.scenario().label())
                .put("language", record.language())
                .put("elapsedMs", record.elapsedMs())
                .put("ok", record.ok());
        json.putOpt("costTokens", record.costTokens());
        json.putOpt("audioBytes", record.audioBytes());
        json.putOpt("error", record.errorMessage());
        return json;
    }
}
