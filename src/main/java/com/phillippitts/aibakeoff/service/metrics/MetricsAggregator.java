package com.phillippitts.aibakeoff.service.metrics;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces the full set of measurement records to one {@link SummaryRow} per
 * (provider, scenario) group.
 *
 * <p>Latency percentiles consider successful records only; {@code okRate} counts every
 * record in the group. Rows come out in first-seen order of their group, unsorted.
 *
 * <p>Thread-safe: stateless.
 */
@Component
public class MetricsAggregator {

    /**
     * Groups and summarizes {@code records}.
     *
     * @param records every record of a run, in any order
     * @return one row per group, in first-seen group order
     */
    public List<SummaryRow> summarize(Collection<MeasurementRecord> records) {
        Objects.requireNonNull(records, "records");
        Map<GroupKey, List<MeasurementRecord>> groups = new LinkedHashMap<>();
        for (MeasurementRecord record : records) {
            groups.computeIfAbsent(new GroupKey(record.provider(), record.scenario()), k -> new ArrayList<>())
                    .add(record);
        }

        List<SummaryRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<GroupKey, List<MeasurementRecord>> entry : groups.entrySet()) {
            rows.add(summarizeGroup(entry.getKey(), entry.getValue()));
        }
        return rows;
    }

    private static SummaryRow summarizeGroup(GroupKey key, List<MeasurementRecord> group) {
        List<Double> latencies = new ArrayList<>();
        long audioTotal = 0;
        int audioCount = 0;
        for (MeasurementRecord record : group) {
            if (!record.ok()) {
                continue;
            }
            latencies.add(record.elapsedMs());
            if (record.audioBytes() != null) {
                audioTotal += record.audioBytes();
                audioCount++;
            }
        }
        double okRate = group.isEmpty() ? 0.0 : (double) latencies.size() / group.size();
        Double avgAudioBytes = audioCount == 0 ? null : (double) audioTotal / audioCount;
        return new SummaryRow(key.provider(), key.scenario(),
                percentile(latencies, 50), percentile(latencies, 95), okRate, avgAudioBytes);
    }

    /**
     * Nearest-rank style percentile: sorts ascending and takes the value at
     * {@code floor(p / 100 * count)}, clamped to the last index.
     *
     * @param samples latencies in milliseconds (not modified)
     * @param p percentile in [0, 100]
     * @return the selected sample, or 0 for an empty list
     */
    public static double percentile(List<Double> samples, double p) {
        if (samples == null || samples.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(samples);
        sorted.sort(null);
        int idx = Math.min(sorted.size() - 1, (int) Math.floor((p / 100.0) * sorted.size()));
        return sorted.get(Math.max(0, idx));
    }

    private record GroupKey(ProviderTag provider, Scenario scenario) {
    }
}
