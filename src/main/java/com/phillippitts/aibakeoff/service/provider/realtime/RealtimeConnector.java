package com.phillippitts.aibakeoff.service.provider.realtime;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens duplex connections for realtime sessions.
 */
public interface RealtimeConnector {

    /**
     * Starts connecting to {@code uri} and routes all connection events to {@code listener}.
     *
     * <p>The returned future completes when the handshake finishes and completes
     * exceptionally if it fails. Cancelling it abandons a pending handshake.
     *
     * @param uri endpoint to connect to
     * @param headers handshake headers, e.g. {@code Authorization}
     * @param listener receiver of open, message, close and error events
     * @return handshake future
     */
    CompletableFuture<?> connect(URI uri, Map<String, String> headers, RealtimeSocketListener listener);
}
