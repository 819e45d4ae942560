package com.phillippitts.aibakeoff.service.provider.realtime;

/**
 * Inbound events of a duplex connection. Transports translate their native callbacks into
 * these calls; implementations must tolerate them arriving on any thread.
 */
public interface RealtimeSocketListener {

    void onOpen(RealtimeSocket socket);

    void onMessage(String payload);

    void onClose(int code, String reason);

    void onTransportError(Throwable error);
}
