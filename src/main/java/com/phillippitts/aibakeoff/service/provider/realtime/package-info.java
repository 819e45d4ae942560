/**
 * Streaming speech synthesis over a stateful duplex protocol.
 *
 * <p>{@link com.phillippitts.aibakeoff.service.provider.realtime.RealtimeSpeechSession} holds
 * the protocol state machine and is transport-agnostic;
 * {@link com.phillippitts.aibakeoff.service.provider.realtime.SpringRealtimeConnector} binds
 * it to Spring's WebSocket client.
 */
package com.phillippitts.aibakeoff.service.provider.realtime;
