package com.phillippitts.aibakeoff.domain;

/**
 * Aggregated latency and success figures for one (provider, scenario) group.
 *
 * @param avgAudioBytes mean audio size of successful records, or {@code null} when no
 *                      record in the group reported audio
 */
public record SummaryRow(
        ProviderTag provider,
        Scenario scenario,
        double p50,
        double p95,
        double okRate,
        Double avgAudioBytes
) {
}
