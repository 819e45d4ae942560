package com.phillippitts.aibakeoff.domain;

import java.util.Objects;

/**
 * Seed input for translation and pipeline runs.
 */
public record TranslationPair(String source, String target, String text) {

    public TranslationPair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Returns the {@code source->target} label used in measurement records.
     */
    public String languageLabel() {
        return source + "->" + target;
    }
}
