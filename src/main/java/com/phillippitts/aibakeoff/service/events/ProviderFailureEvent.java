package com.phillippitts.aibakeoff.service.events;

import java.time.Instant;

/**
 * Published when a provider call inside a scenario fails.
 *
 * <p>Carries the error text only; never the prompt or translated text.
 */
public record ProviderFailureEvent(
        String provider,
        String scenario,
        String language,
        Instant at,
        String message
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
