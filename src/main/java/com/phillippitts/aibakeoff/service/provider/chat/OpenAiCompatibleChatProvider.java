package com.phillippitts.aibakeoff.service.provider.chat;

import com.phillippitts.aibakeoff.config.properties.ProviderProperties.ChatProperties;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.exception.ProviderException;
import com.phillippitts.aibakeoff.exception.ProviderExceptionBuilder;
import com.phillippitts.aibakeoff.service.provider.TranslationProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import com.phillippitts.aibakeoff.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Translation adapter for any vendor exposing the OpenAI chat-completions protocol.
 *
 * <p>One instance is created per vendor (Groq and OpenAI) with that vendor's endpoint,
 * model and bearer token. Each {@link #translate(TranslationPair)} call issues exactly one
 * POST; there are no retries.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>Missing credential: {@code "Missing <ENV_NAME>"}</li>
 *   <li>Non-2xx response: {@code "<Vendor> chat failed: <status> <body>"}</li>
 *   <li>Body that is not JSON: {@code "<Vendor> chat returned malformed JSON"}</li>
 *   <li>Transport errors and read timeouts surface as Spring
 *       {@link org.springframework.web.client.ResourceAccessException}</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Stateless apart from immutable configuration; safe for
 * concurrent use.
 */
public class OpenAiCompatibleChatProvider implements TranslationProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleChatProvider.class);

    private final Provider provider;
    private final String credentialName;
    private final ChatProperties properties;
    private final RestClient restClient;

    /**
     * @param provider vendor identity (must be a translation provider)
     * @param credentialName environment variable name reported when the key is missing
     * @param properties endpoint, model and API key
     * @param restClient shared HTTP client with connect/read timeouts applied
     */
    public OpenAiCompatibleChatProvider(Provider provider,
                                        String credentialName,
                                        ChatProperties properties,
                                        RestClient restClient) {
        this.provider = Objects.requireNonNull(provider, "provider");
        if (provider.capability() != Provider.Capability.TRANSLATION) {
            throw new IllegalArgumentException(provider + " is not a translation provider");
        }
        this.credentialName = Objects.requireNonNull(credentialName, "credentialName");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public Provider provider() {
        return provider;
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    @Override
    public TranslationResult translate(TranslationPair pair) {
        Objects.requireNonNull(pair, "pair");
        if (!isConfigured()) {
            throw new ProviderException("Missing " + credentialName, provider.tag());
        }

        String body = ChatCompletionJsonParser.requestBody(properties.getModel(), properties.getTemperature(),
                pair.source(), pair.target(), pair.text()).toString();

        TranslationResult result = restClient.post()
                .uri(properties.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .body(body)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    String payload = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        throw ProviderExceptionBuilder
                                .create(provider.displayName() + " chat failed: " + status + " " + payload)
                                .provider(provider.tag())
                                .httpStatus(status)
                                .build();
                    }
                    return ChatCompletionJsonParser.parse(payload, provider);
                });

        if (LOG.isDebugEnabled()) {
            LOG.debug("{} translated {}: '{}' (tokens={})", provider.tag(), pair.languageLabel(),
                    LogSanitizer.preview(result.text()), result.totalTokens());
        }
        return result;
    }
}
