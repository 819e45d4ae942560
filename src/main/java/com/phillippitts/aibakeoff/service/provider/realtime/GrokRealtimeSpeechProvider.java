package com.phillippitts.aibakeoff.service.provider.realtime;

import com.phillippitts.aibakeoff.config.properties.ProviderProperties.GrokProperties;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.exception.ProviderException;
import com.phillippitts.aibakeoff.exception.RealtimeSessionException;
import com.phillippitts.aibakeoff.service.provider.SpeechResult;
import com.phillippitts.aibakeoff.service.provider.SpeechSynthesisProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Speech adapter for Grok realtime voice over a WebSocket session.
 *
 * <p>Each {@link #synthesize(String, String)} call opens a fresh connection, drives a
 * {@link RealtimeSpeechSession} to a terminal state and blocks the calling thread until then.
 * The session's deadline bounds the wait.
 *
 * <p>The configured URL must use {@code wss://}. When it has no query string,
 * {@code ?model=<model>} is appended.
 */
public class GrokRealtimeSpeechProvider implements SpeechSynthesisProvider {

    private final GrokProperties properties;
    private final RealtimeConnector connector;
    private final TaskScheduler deadlineScheduler;

    public GrokRealtimeSpeechProvider(GrokProperties properties,
                                      RealtimeConnector connector,
                                      TaskScheduler deadlineScheduler) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.deadlineScheduler = Objects.requireNonNull(deadlineScheduler, "deadlineScheduler");
    }

    @Override
    public Provider provider() {
        return Provider.GROK;
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey() && StringUtils.hasText(properties.getUrl());
    }

    @Override
    public SpeechResult synthesize(String text, String language) {
        Objects.requireNonNull(text, "text");
        if (!isConfigured()) {
            throw new ProviderException("Missing GROK_VOICE_API_KEY or GROK_VOICE_URL", provider().tag());
        }
        URI uri = resolveUri(properties.getUrl(), properties.getModel());

        RealtimeSpeechSession session = new RealtimeSpeechSession(
                provider(), text, properties.getVoice(), properties.getSampleRate());
        session.armDeadline(deadlineScheduler, Duration.ofMillis(properties.getTimeoutMs()));

        CompletableFuture<?> connecting;
        try {
            connecting = connector.connect(uri,
                    Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey()), session);
        } catch (RuntimeException e) {
            session.onTransportError(e);
            connecting = CompletableFuture.completedFuture(null);
        }
        connecting.whenComplete((ignored, error) -> {
            if (error != null) {
                session.onTransportError(unwrap(error));
            }
        });

        try {
            return new SpeechResult(session.result().join());
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw new RealtimeSessionException(provider().displayName() + " WS error: " + cause.getMessage(),
                    provider().tag(), session.state(), cause);
        } finally {
            if (!connecting.isDone()) {
                connecting.cancel(true);
            }
        }
    }

    /**
     * Resolves the session URI, appending {@code ?model=} when the URL has no query.
     *
     * @throws ProviderException if the resolved URL is not {@code wss://}
     */
    static URI resolveUri(String url, String model) {
        String resolved = url.contains("?") ? url : url + "?model=" + model;
        if (!resolved.startsWith("wss://")) {
            throw new ProviderException("Grok voice URL must be WebSocket (wss://) for realtime voice",
                    Provider.GROK.tag());
        }
        return URI.create(resolved);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException) && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof CancellationException) {
            return new IllegalStateException("connection attempt cancelled", current);
        }
        return current;
    }
}
