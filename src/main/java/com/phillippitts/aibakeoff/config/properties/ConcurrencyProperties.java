package com.phillippitts.aibakeoff.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Concurrency ceilings for the scenario runners.
 *
 * <p>Properties:
 * <ul>
 *   <li>bakeoff.concurrency.translation-max - In-flight translation tasks (default: 10)</li>
 *   <li>bakeoff.concurrency.tts-max - In-flight TTS and pipeline tasks (default: 20)</li>
 *   <li>bakeoff.concurrency.elevenlabs-max - Concurrent ElevenLabs calls, nested inside the
 *       TTS/pipeline pool (default: 5)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "bakeoff.concurrency")
@Validated
public class ConcurrencyProperties {

    /** Maximum in-flight translation tasks. */
    @Positive(message = "Translation max concurrency must be positive")
    private int translationMax = 10;

    /** Maximum in-flight TTS and pipeline tasks. */
    @Positive(message = "TTS max concurrency must be positive")
    private int ttsMax = 20;

    /** Maximum concurrent calls to the rate-sensitive REST speech provider. */
    @Positive(message = "ElevenLabs max concurrency must be positive")
    private int elevenlabsMax = 5;

    public int getTranslationMax() {
        return translationMax;
    }

    public void setTranslationMax(int translationMax) {
        this.translationMax = translationMax;
    }

    public int getTtsMax() {
        return ttsMax;
    }

    public void setTtsMax(int ttsMax) {
        this.ttsMax = ttsMax;
    }

    public int getElevenlabsMax() {
        return elevenlabsMax;
    }

    public void setElevenlabsMax(int elevenlabsMax) {
        this.elevenlabsMax = elevenlabsMax;
    }
}
