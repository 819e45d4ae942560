package com.phillippitts.aibakeoff.service.provider.realtime;

import com.phillippitts.aibakeoff.config.properties.ProviderProperties.GrokProperties;
import com.phillippitts.aibakeoff.exception.ProviderException;
import com.phillippitts.aibakeoff.exception.RealtimeSessionException;
import com.phillippitts.aibakeoff.service.provider.SpeechResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class GrokRealtimeSpeechProviderTest {

    private ThreadPoolTaskScheduler scheduler;
    private GrokProperties properties;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        properties = new GrokProperties();
        properties.setApiKey("grok-test");
        properties.setUrl("wss://voice.example.test/v1/realtime");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void appendsModelWhenUrlHasNoQuery() {
        assertThat(GrokRealtimeSpeechProvider.resolveUri("wss://h/v1/realtime", "grok-2-latest"))
                .isEqualTo(URI.create("wss://h/v1/realtime?model=grok-2-latest"));
    }

    @Test
    void keepsExistingQuery() {
        assertThat(GrokRealtimeSpeechProvider.resolveUri("wss://h/v1/realtime?model=custom", "grok-2-latest"))
                .isEqualTo(URI.create("wss://h/v1/realtime?model=custom"));
    }

    @Test
    void rejectsNonSecureWebSocketUrl() {
        assertThatThrownBy(() -> GrokRealtimeSpeechProvider.resolveUri("https://h/v1/realtime", "m"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("wss://");
    }

    @Test
    void missingUrlIsNotConfigured() {
        properties.setUrl("");
        GrokRealtimeSpeechProvider provider = provider((uri, headers, listener) -> {
            throw new AssertionError("should not connect");
        });

        assertThat(provider.isConfigured()).isFalse();
        assertThatThrownBy(() -> provider.synthesize("Hi", "en"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Missing GROK_VOICE_API_KEY or GROK_VOICE_URL");
    }

    @Test
    void synthesizesFromScriptedSession() {
        AtomicReference<URI> connectedTo = new AtomicReference<>();
        AtomicReference<Map<String, String>> sentHeaders = new AtomicReference<>();
        FakeRealtimeSocket socket = new FakeRealtimeSocket();

        GrokRealtimeSpeechProvider provider = provider((uri, headers, listener) -> {
            connectedTo.set(uri);
            sentHeaders.set(headers);
            listener.onOpen(socket);
            listener.onMessage(delta("pcm-1|"));
            listener.onMessage(delta("pcm-2"));
            listener.onMessage("{\"type\":\"response.output_audio.done\"}");
            return CompletableFuture.completedFuture(null);
        });

        SpeechResult result = provider.synthesize("Gracias por llamar.", "es");

        assertThat(new String(result.audio(), StandardCharsets.UTF_8)).isEqualTo("pcm-1|pcm-2");
        assertThat(connectedTo.get().toString()).endsWith("?model=grok-2-latest");
        assertThat(sentHeaders.get()).containsEntry("Authorization", "Bearer grok-test");
        assertThat(socket.sentTypes()).hasSize(3);
        assertThat(socket.closes.get()).isEqualTo(1);
    }

    @Test
    void handshakeFailureBecomesProviderError() {
        GrokRealtimeSpeechProvider provider = provider((uri, headers, listener) ->
                CompletableFuture.failedFuture(new IOException("handshake refused")));

        assertThatThrownBy(() -> provider.synthesize("Hi", "en"))
                .isInstanceOf(RealtimeSessionException.class)
                .hasMessage("Grok WS error: handshake refused");
    }

    @Test
    void hungHandshakeTimesOutAndIsCancelled() {
        properties.setTimeoutMs(100);
        CompletableFuture<Object> pending = new CompletableFuture<>();
        GrokRealtimeSpeechProvider provider = provider((uri, headers, listener) -> pending);

        long start = System.nanoTime();
        Throwable thrown = catchThrowable(() -> provider.synthesize("Hi", "en"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(elapsedMs).isBetween(50L, 600L);
        assertThat(thrown).isInstanceOf(RealtimeSessionException.class)
                .hasMessage("Grok TTS timed out after 100 ms");
        assertThat(((RealtimeSessionException) thrown).getTerminalState()).isEqualTo(SessionState.TIMED_OUT);
        assertThat(pending).isCancelled();
    }

    private GrokRealtimeSpeechProvider provider(RealtimeConnector connector) {
        return new GrokRealtimeSpeechProvider(properties, connector, scheduler);
    }

    private static String delta(String text) {
        return "{\"type\":\"response.audio.delta\",\"delta\":\""
                + Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8)) + "\"}";
    }
}
