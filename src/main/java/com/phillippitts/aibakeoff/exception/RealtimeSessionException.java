package com.phillippitts.aibakeoff.exception;

import com.phillippitts.aibakeoff.service.provider.realtime.SessionState;

/**
 * Thrown when a realtime speech session ends in {@link SessionState#FAILED} or
 * {@link SessionState#TIMED_OUT}.
 */
public class RealtimeSessionException extends ProviderException {

    private final SessionState terminalState;

    public RealtimeSessionException(String message, String providerName, SessionState terminalState) {
        super(message, providerName);
        this.terminalState = terminalState;
    }

    public RealtimeSessionException(String message, String providerName, SessionState terminalState,
                                    Throwable cause) {
        super(message, providerName, cause);
        this.terminalState = terminalState;
    }

    public SessionState getTerminalState() {
        return terminalState;
    }
}
