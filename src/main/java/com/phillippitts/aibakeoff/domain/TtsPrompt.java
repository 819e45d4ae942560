package com.phillippitts.aibakeoff.domain;

import java.util.Objects;

/**
 * Seed input for text-to-speech runs.
 */
public record TtsPrompt(String language, String text) {

    public TtsPrompt {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(text, "text");
    }
}
