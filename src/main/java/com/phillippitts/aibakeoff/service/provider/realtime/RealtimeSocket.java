package com.phillippitts.aibakeoff.service.provider.realtime;

import java.io.IOException;

/**
 * Outbound half of an open duplex connection, as seen by a {@link RealtimeSpeechSession}.
 */
public interface RealtimeSocket {

    /**
     * Sends one text frame.
     *
     * @throws IOException if the frame cannot be written
     */
    void send(String text) throws IOException;

    /**
     * Closes the connection normally. Safe to call on an already closed socket.
     */
    void close();

    /**
     * Tears the connection down without waiting for the peer, used when a deadline fires.
     */
    void terminate();
}
