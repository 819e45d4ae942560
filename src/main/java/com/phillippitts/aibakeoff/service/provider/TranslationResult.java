package com.phillippitts.aibakeoff.service.provider;

import java.util.Objects;

/**
 * Output of a translation call.
 *
 * @param text translated text, trimmed; empty when the provider returned no content
 * @param totalTokens token usage reported by the provider, or {@code null}
 */
public record TranslationResult(String text, Integer totalTokens) {

    public TranslationResult {
        Objects.requireNonNull(text, "text");
    }
}
