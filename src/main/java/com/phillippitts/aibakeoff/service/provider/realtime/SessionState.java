package com.phillippitts.aibakeoff.service.provider.realtime;

/**
 * Lifecycle of one realtime speech session.
 *
 * <pre>
 * CONNECTING → OPEN → AWAITING_AUDIO → COMPLETE
 *      any non-terminal state → FAILED
 *      any non-terminal state → TIMED_OUT
 * </pre>
 */
public enum SessionState {
    CONNECTING,
    OPEN,
    AWAITING_AUDIO,
    COMPLETE,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == TIMED_OUT;
    }
}
