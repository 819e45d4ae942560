package com.phillippitts.aibakeoff.config;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.config.properties.HttpClientProperties;
import com.phillippitts.aibakeoff.config.properties.ProviderProperties;
import com.phillippitts.aibakeoff.domain.BenchmarkInputs;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import com.phillippitts.aibakeoff.service.provider.TranslationProvider;
import com.phillippitts.aibakeoff.service.provider.chat.OpenAiCompatibleChatProvider;
import com.phillippitts.aibakeoff.service.provider.elevenlabs.ElevenLabsSpeechProvider;
import com.phillippitts.aibakeoff.service.provider.realtime.GrokRealtimeSpeechProvider;
import com.phillippitts.aibakeoff.service.provider.realtime.RealtimeConnector;
import com.phillippitts.aibakeoff.service.provider.realtime.SpringRealtimeConnector;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the four benchmarked providers and their transports.
 *
 * <p>Providers are always created, with or without credentials. A provider without a
 * credential reports {@code isConfigured() == false}; optional baselines are then skipped by
 * the runners and required ones fail each call with a "Missing ..." message.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    @Bean
    public BenchmarkInputs benchmarkInputs() {
        return BenchmarkInputs.defaults();
    }

    /**
     * Shared HTTP client for request/response providers, with connect and read timeouts
     * from {@code bakeoff.http.*}.
     */
    @Bean(name = "providerRestClient")
    public RestClient providerRestClient(RestClient.Builder builder, HttpClientProperties http) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(http.getConnectTimeoutMs());
        factory.setReadTimeout(http.getReadTimeoutMs());
        return builder.requestFactory(factory).build();
    }

    @Bean(name = "groqTranslationProvider")
    public TranslationProvider groqTranslationProvider(ProviderProperties props,
                                                       @Qualifier("providerRestClient") RestClient restClient) {
        logCredential(Provider.GROQ, props.getGroq().hasApiKey());
        return new OpenAiCompatibleChatProvider(Provider.GROQ, "GROQ_API_KEY", props.getGroq(), restClient);
    }

    @Bean(name = "openAiTranslationProvider")
    public TranslationProvider openAiTranslationProvider(ProviderProperties props,
                                                         @Qualifier("providerRestClient") RestClient restClient) {
        logCredential(Provider.OPENAI, props.getOpenai().hasApiKey());
        return new OpenAiCompatibleChatProvider(Provider.OPENAI, "OPENAI_API_KEY", props.getOpenai(), restClient);
    }

    @Bean(name = "elevenLabsSpeechProvider")
    public SpeechSynthesisProvider elevenLabsSpeechProvider(ProviderProperties props,
                                                            @Qualifier("providerRestClient") RestClient restClient) {
        ElevenLabsSpeechProvider provider = new ElevenLabsSpeechProvider(props.getElevenlabs(), restClient);
        logCredential(Provider.ELEVENLABS, provider.isConfigured());
        return provider;
    }

    /**
     * Per-account ElevenLabs ceiling shared by every scenario that calls it.
     */
    @Bean(name = "elevenLabsLimiter")
    public ConcurrencyLimiter elevenLabsLimiter(ConcurrencyProperties concurrency) {
        return new ConcurrencyLimiter(Provider.ELEVENLABS.tag(), concurrency.getElevenlabsMax());
    }

    /**
     * JSR-356 WebSocket client whose text buffer fits a whole audio delta message.
     */
    @Bean
    public WebSocketClient realtimeWebSocketClient(ProviderProperties props) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(props.getGrok().getMaxMessageBytes());
        return new StandardWebSocketClient(container);
    }

    @Bean
    public RealtimeConnector realtimeConnector(WebSocketClient realtimeWebSocketClient) {
        return new SpringRealtimeConnector(realtimeWebSocketClient);
    }

    @Bean(name = "grokSpeechProvider")
    public SpeechSynthesisProvider grokSpeechProvider(ProviderProperties props,
                                                      RealtimeConnector realtimeConnector,
                                                      @Qualifier("realtimeDeadlineScheduler") TaskScheduler scheduler) {
        GrokRealtimeSpeechProvider provider =
                new GrokRealtimeSpeechProvider(props.getGrok(), realtimeConnector, scheduler);
        logCredential(Provider.GROK, provider.isConfigured());
        return provider;
    }

    private static void logCredential(Provider provider, boolean configured) {
        if (configured) {
            LOG.info("{} provider configured", provider.displayName());
        } else {
            LOG.info("{} provider has no credential", provider.displayName());
        }
    }
}
