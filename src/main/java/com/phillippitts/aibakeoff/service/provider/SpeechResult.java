package com.phillippitts.aibakeoff.service.provider;

import java.util.Objects;

/**
 * Synthesized audio returned by a {@link SpeechSynthesisProvider}.
 *
 * <p>The array is owned by this result; callers must not modify it.
 */
public record SpeechResult(byte[] audio) {

    public SpeechResult {
        Objects.requireNonNull(audio, "audio");
    }

    public int audioBytes() {
        return audio.length;
    }
}
