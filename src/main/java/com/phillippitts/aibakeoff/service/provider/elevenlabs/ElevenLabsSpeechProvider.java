package com.phillippitts.aibakeoff.service.provider.elevenlabs;

import com.phillippitts.aibakeoff.config.properties.ProviderProperties.ElevenLabsProperties;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.exception.ProviderException;
import com.phillippitts.aibakeoff.exception.ProviderExceptionBuilder;
import com.phillippitts.aibakeoff.service.provider.SpeechResult;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Stateless REST speech adapter for ElevenLabs.
 *
 * <p>Issues {@code POST {baseUrl}/v1/text-to-speech/{voiceId}} with an {@code xi-api-key}
 * header and returns the raw binary audio body. The provider has a strict per-account
 * concurrency ceiling, so runners call it under a dedicated narrower limiter.
 */
public class ElevenLabsSpeechProvider implements SpeechSynthesisProvider {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsSpeechProvider.class);

    static final String API_KEY_HEADER = "xi-api-key";

    private final ElevenLabsProperties properties;
    private final RestClient restClient;

    public ElevenLabsSpeechProvider(ElevenLabsProperties properties, RestClient restClient) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public Provider provider() {
        return Provider.ELEVENLABS;
    }

    /**
     * Configured when the API key is present. A missing voice id is reported as a failure
     * on each call rather than skipping the provider.
     */
    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    @Override
    public SpeechResult synthesize(String text, String language) {
        Objects.requireNonNull(text, "text");
        if (!properties.hasApiKey() || !StringUtils.hasText(properties.getVoiceId())) {
            throw new ProviderException("Missing ELEVENLABS_API_KEY or ELEVENLABS_VOICE_ID", provider().tag());
        }

        JSONObject body = new JSONObject()
                .put("text", text)
                .put("model_id", properties.getModelId())
                .put("voice_settings", new JSONObject()
                        .put("stability", properties.getStability())
                        .put("similarity_boost", properties.getSimilarityBoost()))
                .put("output_format", properties.getOutputFormat());

        byte[] audio = restClient.post()
                .uri(properties.getBaseUrl() + "/v1/text-to-speech/{voiceId}", properties.getVoiceId())
                .contentType(MediaType.APPLICATION_JSON)
                .header(API_KEY_HEADER, properties.getApiKey())
                .body(body.toString())
                .exchange((request, response) -> {
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        int status = response.getStatusCode().value();
                        String error = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        throw ProviderExceptionBuilder
                                .create("ElevenLabs TTS failed: " + status + " " + error)
                                .provider(provider().tag())
                                .httpStatus(status)
                                .build();
                    }
                    return StreamUtils.copyToByteArray(response.getBody());
                });

        LOG.debug("elevenlabs synthesized {} bytes for language={}", audio.length, language);
        return new SpeechResult(audio);
    }
}
