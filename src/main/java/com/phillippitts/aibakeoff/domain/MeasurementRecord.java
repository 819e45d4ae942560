package com.phillippitts.aibakeoff.domain;

import java.util.Objects;

/**
 * One measured unit of work: a single provider call, or a chained translation and synthesis.
 *
 * <p>Records are immutable. A failed record always has {@code elapsedMs == 0} and a
 * non-null {@code errorMessage}; a successful one never carries an error message.
 *
 * @param provider who produced the result
 * @param scenario benchmark mode the record belongs to
 * @param language a language code, or {@code source->target}
 * @param elapsedMs wall-clock duration in milliseconds; for pipelines the sum of both steps
 * @param costTokens total LLM tokens, when the chat provider reported usage
 * @param audioBytes size of synthesized audio, for speech results
 * @param ok whether the unit of work completed successfully
 * @param errorMessage failure description, present iff {@code ok} is false
 */
public record MeasurementRecord(
        ProviderTag provider,
        Scenario scenario,
        String language,
        double elapsedMs,
        Integer costTokens,
        Integer audioBytes,
        boolean ok,
        String errorMessage
) {
    public MeasurementRecord {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(language, "language");
        if (elapsedMs < 0.0 || Double.isNaN(elapsedMs)) {
            throw new IllegalArgumentException("elapsedMs must be non-negative");
        }
        if (ok && errorMessage != null) {
            throw new IllegalArgumentException("successful record cannot carry an error message");
        }
        if (!ok) {
            if (errorMessage == null) {
                throw new IllegalArgumentException("failed record requires an error message");
            }
            if (elapsedMs != 0.0) {
                throw new IllegalArgumentException("failed record must have elapsedMs == 0");
            }
        }
    }

    public static MeasurementRecord success(ProviderTag provider, Scenario scenario, String language,
                                            double elapsedMs, Integer costTokens, Integer audioBytes) {
        return new MeasurementRecord(provider, scenario, language, elapsedMs, costTokens, audioBytes, true, null);
    }

    public static MeasurementRecord failure(ProviderTag provider, Scenario scenario, String language,
                                            String errorMessage) {
        return new MeasurementRecord(provider, scenario, language, 0.0, null, null, false,
                errorMessage == null ? "unknown error" : errorMessage);
    }
}
