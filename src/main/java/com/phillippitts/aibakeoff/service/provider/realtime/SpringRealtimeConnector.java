package com.phillippitts.aibakeoff.service.provider.realtime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RealtimeConnector} backed by Spring's {@link WebSocketClient}.
 *
 * <p>Each connection gets its own handler that forwards Spring callbacks to the
 * session's {@link RealtimeSocketListener}.
 */
public class SpringRealtimeConnector implements RealtimeConnector {

    private static final Logger LOG = LogManager.getLogger(SpringRealtimeConnector.class);

    private final WebSocketClient client;

    public SpringRealtimeConnector(WebSocketClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<?> connect(URI uri, Map<String, String> headers, RealtimeSocketListener listener) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");
        WebSocketHttpHeaders handshakeHeaders = new WebSocketHttpHeaders();
        if (headers != null) {
            headers.forEach(handshakeHeaders::add);
        }
        LOG.debug("Opening realtime connection to {}://{}{}", uri.getScheme(), uri.getHost(), uri.getPath());
        return client.execute(new ListenerHandler(listener), handshakeHeaders, uri);
    }

    private static final class ListenerHandler extends TextWebSocketHandler {
        private final RealtimeSocketListener listener;

        ListenerHandler(RealtimeSocketListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen(new SessionSocket(session));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onTransportError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode(), status.getReason());
        }
    }

    private static final class SessionSocket implements RealtimeSocket {
        private final WebSocketSession session;

        SessionSocket(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public void close() {
            closeWith(CloseStatus.NORMAL);
        }

        @Override
        public void terminate() {
            closeWith(CloseStatus.GOING_AWAY);
        }

        private void closeWith(CloseStatus status) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(status);
            } catch (IOException e) {
                // Session outcome is already decided; only the close handshake failed
                LOG.debug("Failed to close realtime connection {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
