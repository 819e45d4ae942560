package com.phillippitts.aibakeoff.domain;

/**
 * Closed set of external vendors benchmarked by the harness.
 *
 * <p>Each provider implements exactly one {@link Capability}. The {@link #tag()} is the
 * lowercase identifier used in reports and metric tags.
 */
public enum Provider {

    GROQ("groq", "Groq", Capability.TRANSLATION),
    OPENAI("openai", "OpenAI", Capability.TRANSLATION),
    GROK("grok", "Grok", Capability.SPEECH),
    ELEVENLABS("elevenlabs", "ElevenLabs", Capability.SPEECH);

    /** What a provider is benchmarked for. */
    public enum Capability { TRANSLATION, SPEECH }

    private final String tag;
    private final String displayName;
    private final Capability capability;

    Provider(String tag, String displayName, Capability capability) {
        this.tag = tag;
        this.displayName = displayName;
        this.capability = capability;
    }

    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    public Capability capability() {
        return capability;
    }
}
