package com.phillippitts.aibakeoff.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Credentials and endpoints for the four benchmarked providers.
 *
 * <p>Credentials are left empty by default and are normally supplied through the
 * environment variables mapped in {@code application.properties}:
 * <ul>
 *   <li>bakeoff.providers.groq.api-key - {@code GROQ_API_KEY}</li>
 *   <li>bakeoff.providers.openai.api-key - {@code OPENAI_API_KEY}</li>
 *   <li>bakeoff.providers.grok.api-key / url / voice - {@code GROK_VOICE_API_KEY},
 *       {@code GROK_VOICE_URL}, {@code GROK_VOICE_VOICE}</li>
 *   <li>bakeoff.providers.elevenlabs.api-key / voice-id - {@code ELEVENLABS_API_KEY},
 *       {@code ELEVENLABS_VOICE_ID}</li>
 * </ul>
 *
 * <p>Read once at startup; adapters never re-validate them per call beyond checking that
 * the credential is present.
 */
@ConfigurationProperties(prefix = "bakeoff.providers")
@Validated
public class ProviderProperties {

    @Valid
    private ChatProperties groq = new ChatProperties(
            "https://api.groq.com/openai/v1/chat/completions", "llama-3.3-70b-versatile");

    @Valid
    private ChatProperties openai = new ChatProperties(
            "https://api.openai.com/v1/chat/completions", "gpt-4o-mini");

    @Valid
    private GrokProperties grok = new GrokProperties();

    @Valid
    private ElevenLabsProperties elevenlabs = new ElevenLabsProperties();

    public ChatProperties getGroq() {
        return groq;
    }

    public void setGroq(ChatProperties groq) {
        this.groq = groq;
    }

    public ChatProperties getOpenai() {
        return openai;
    }

    public void setOpenai(ChatProperties openai) {
        this.openai = openai;
    }

    public GrokProperties getGrok() {
        return grok;
    }

    public void setGrok(GrokProperties grok) {
        this.grok = grok;
    }

    public ElevenLabsProperties getElevenlabs() {
        return elevenlabs;
    }

    public void setElevenlabs(ElevenLabsProperties elevenlabs) {
        this.elevenlabs = elevenlabs;
    }

    /**
     * OpenAI-compatible chat-completions endpoint.
     */
    public static class ChatProperties {
        private String apiKey = "";

        @NotBlank
        private String url;

        @NotBlank
        private String model;

        private double temperature = 0.1;

        public ChatProperties() {
        }

        public ChatProperties(String url, String model) {
            this.url = url;
            this.model = model;
        }

        public boolean hasApiKey() {
            return StringUtils.hasText(apiKey);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    /**
     * Grok realtime voice over WebSocket.
     */
    public static class GrokProperties {
        private String apiKey = "";
        private String url = "";

        @NotBlank
        private String voice = "Ara";

        /** Appended as {@code ?model=} when the URL carries no query string. */
        @NotBlank
        private String model = "grok-2-latest";

        /** Deadline for one synthesis session, from connect to completion. */
        @Positive
        private long timeoutMs = 25_000;

        /** PCM output sample rate requested in the session configuration. */
        @Positive
        private int sampleRate = 24_000;

        /** Largest inbound text frame accepted; audio deltas arrive as base64 JSON. */
        @Positive
        private int maxMessageBytes = 4 * 1024 * 1024;

        public boolean hasApiKey() {
            return StringUtils.hasText(apiKey);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }

        public int getMaxMessageBytes() {
            return maxMessageBytes;
        }

        public void setMaxMessageBytes(int maxMessageBytes) {
            this.maxMessageBytes = maxMessageBytes;
        }
    }

    /**
     * ElevenLabs REST text-to-speech.
     */
    public static class ElevenLabsProperties {
        private String apiKey = "";
        private String voiceId = "";

        @NotBlank
        private String baseUrl = "https://api.elevenlabs.io";

        @NotBlank
        private String modelId = "eleven_multilingual_v2";

        @NotBlank
        private String outputFormat = "mp3_64k";

        private double stability = 0.5;
        private double similarityBoost = 0.5;

        public boolean hasApiKey() {
            return StringUtils.hasText(apiKey);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getOutputFormat() {
            return outputFormat;
        }

        public void setOutputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
        }

        public double getStability() {
            return stability;
        }

        public void setStability(double stability) {
            this.stability = stability;
        }

        public double getSimilarityBoost() {
            return similarityBoost;
        }

        public void setSimilarityBoost(double similarityBoost) {
            this.similarityBoost = similarityBoost;
        }
    }
}
