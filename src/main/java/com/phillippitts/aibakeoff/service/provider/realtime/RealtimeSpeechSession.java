package com.phillippitts.aibakeoff.service.provider.realtime;

import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.exception.RealtimeSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one streaming speech synthesis over a duplex connection.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CONNECTING → OPEN            (onOpen: three control messages are sent)
 * OPEN → AWAITING_AUDIO        (all control messages written)
 * OPEN/AWAITING_AUDIO → COMPLETE   (completion event: socket closed, audio delivered)
 * any non-terminal → FAILED    (error event, malformed message, transport error, early close)
 * any non-terminal → TIMED_OUT (deadline fired: socket terminated)
 * </pre>
 *
 * <p>Every terminal transition goes through {@link #finish}, which checks and sets the
 * single {@code state} variable under the lock. Only the first terminal transition takes
 * effect; later events, errors and closes are ignored, so {@link #result()} completes
 * exactly once.
 *
 * <p>Audio deltas are appended in arrival order. Out-of-order delivery is not corrected.
 *
 * <p><b>Thread Safety:</b> Callbacks may arrive on transport threads, the deadline on a
 * scheduler thread. State and the chunk buffer are guarded by a {@link ReentrantLock};
 * socket I/O and future completion happen outside it.
 *
 * @since 1.0
 */
public final class RealtimeSpeechSession implements RealtimeSocketListener {

    private static final Logger LOG = LogManager.getLogger(RealtimeSpeechSession.class);

    private final Lock lock = new ReentrantLock();
    private final Provider provider;
    private final String text;
    private final String voice;
    private final int sampleRate;
    private final List<byte[]> chunks = new ArrayList<>();
    private final CompletableFuture<byte[]> result = new CompletableFuture<>();

    private SessionState state = SessionState.CONNECTING;
    private RealtimeSocket socket;
    private ScheduledFuture<?> deadline;
    private long timeoutMs;

    /**
     * @param provider speech provider the session belongs to (used in error messages)
     * @param text text to synthesize
     * @param voice voice identity sent in the session configuration
     * @param sampleRate requested PCM output sample rate
     */
    public RealtimeSpeechSession(Provider provider, String text, String voice, int sampleRate) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.text = Objects.requireNonNull(text, "text");
        this.voice = Objects.requireNonNull(voice, "voice");
        this.sampleRate = sampleRate;
    }

    /**
     * Schedules the session deadline. If no terminal state is reached within
     * {@code timeout}, the socket is terminated and the session fails with
     * {@link SessionState#TIMED_OUT}.
     *
     * @param scheduler scheduler that fires the deadline
     * @param timeout time allowed from now until completion
     */
    public void armDeadline(TaskScheduler scheduler, Duration timeout) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(timeout, "timeout");
        lock.lock();
        try {
            if (state.isTerminal() || deadline != null) {
                return;
            }
            timeoutMs = timeout.toMillis();
            deadline = scheduler.schedule(this::onDeadline, Instant.now().plus(timeout));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onOpen(RealtimeSocket openedSocket) {
        Objects.requireNonNull(openedSocket, "openedSocket");
        boolean accepted;
        lock.lock();
        try {
            accepted = state == SessionState.CONNECTING;
            if (accepted) {
                socket = openedSocket;
                state = SessionState.OPEN;
            }
        } finally {
            lock.unlock();
        }
        if (!accepted) {
            // Connection finished opening after the session already ended
            openedSocket.terminate();
            return;
        }

        try {
            openedSocket.send(RealtimeMessages.sessionUpdate(voice, sampleRate));
            openedSocket.send(RealtimeMessages.conversationItem(text));
            openedSocket.send(RealtimeMessages.responseCreate(voice));
        } catch (IOException | RuntimeException e) {
            fail(prefix() + " WS error: failed to send session setup: " + e.getMessage(), e);
            return;
        }

        lock.lock();
        try {
            if (state == SessionState.OPEN) {
                state = SessionState.AWAITING_AUDIO;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onMessage(String payload) {
        JSONObject msg;
        try {
            msg = new JSONObject(payload);
        } catch (JSONException e) {
            fail(prefix() + " WS parse error: " + e.getMessage(), e);
            return;
        }

        String type = msg.optString("type", "");
        if (RealtimeMessages.AUDIO_DELTA_TYPES.contains(type)) {
            String delta = msg.optString("delta", "");
            if (!delta.isEmpty()) {
                byte[] chunk;
                try {
                    chunk = Base64.getDecoder().decode(delta);
                } catch (IllegalArgumentException e) {
                    fail(prefix() + " WS parse error: invalid base64 audio delta", e);
                    return;
                }
                appendChunk(chunk);
            }
        } else if (RealtimeMessages.COMPLETION_TYPES.contains(type)) {
            finish(SessionState.COMPLETE, null, null);
        } else if (RealtimeMessages.ERROR_TYPE.equals(type) && msg.has("error") && !msg.isNull("error")) {
            Object error = msg.get("error");
            String detail = error instanceof String s ? s : error.toString();
            fail(prefix() + " WS error event: " + detail, null);
        } else {
            LOG.trace("{} ignoring realtime event type={}", provider.tag(), type);
        }
    }

    @Override
    public void onClose(int code, String reason) {
        String suffix = reason == null || reason.isBlank()
                ? " (code=" + code + ")"
                : " (code=" + code + ", reason=" + reason + ")";
        finish(SessionState.FAILED, prefix() + " WS closed before completion" + suffix, null);
    }

    @Override
    public void onTransportError(Throwable error) {
        String detail = error == null ? "unknown" : String.valueOf(error.getMessage());
        fail(prefix() + " WS error: " + detail, error);
    }

    void onDeadline() {
        finish(SessionState.TIMED_OUT, prefix() + " TTS timed out after " + timeoutMs + " ms", null);
    }

    /**
     * Future completed with the concatenated audio on {@link SessionState#COMPLETE}, or
     * exceptionally with a {@link RealtimeSessionException} on any other terminal state.
     */
    public CompletableFuture<byte[]> result() {
        return result;
    }

    public SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of audio deltas buffered so far.
     */
    public int chunkCount() {
        lock.lock();
        try {
            return chunks.size();
        } finally {
            lock.unlock();
        }
    }

    private void appendChunk(byte[] chunk) {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                chunks.add(chunk);
            }
        } finally {
            lock.unlock();
        }
    }

    private void fail(String message, Throwable cause) {
        finish(SessionState.FAILED, message, cause);
    }

    /**
     * The single terminal-transition guard. Returns without effect if the session already
     * reached a terminal state.
     */
    private void finish(SessionState terminal, String errorMessage, Throwable cause) {
        RealtimeSocket toRelease;
        ScheduledFuture<?> timer;
        byte[] audio = null;
        lock.lock();
        try {
            if (state.isTerminal()) {
                LOG.trace("{} session already {}; ignoring transition to {}", provider.tag(), state, terminal);
                return;
            }
            state = terminal;
            toRelease = socket;
            timer = deadline;
            if (terminal == SessionState.COMPLETE) {
                audio = AudioChunks.concat(chunks);
            }
            chunks.clear();
        } finally {
            lock.unlock();
        }

        if (timer != null) {
            timer.cancel(false);
        }
        if (toRelease != null) {
            if (terminal == SessionState.TIMED_OUT) {
                toRelease.terminate();
            } else {
                toRelease.close();
            }
        }

        if (terminal == SessionState.COMPLETE) {
            LOG.debug("{} session complete: {} bytes", provider.tag(), audio.length);
            result.complete(audio);
        } else {
            LOG.debug("{} session {}: {}", provider.tag(), terminal, errorMessage);
            result.completeExceptionally(cause == null
                    ? new RealtimeSessionException(errorMessage, provider.tag(), terminal)
                    : new RealtimeSessionException(errorMessage, provider.tag(), terminal, cause));
        }
    }

    private String prefix() {
        return provider.displayName();
    }
}
