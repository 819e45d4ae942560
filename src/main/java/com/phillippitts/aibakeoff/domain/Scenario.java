package com.phillippitts.aibakeoff.domain;

/**
 * The three benchmark modes. Declaration order is the order the driver runs them in.
 */
public enum Scenario {

    TRANSLATION("translation"),
    TTS("tts"),
    PIPELINE("translation+tts");

    private final String label;

    Scenario(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
