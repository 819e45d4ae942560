package com.phillippitts.aibakeoff.service.provider.realtime;

import java.util.List;

/**
 * Joins streamed audio deltas into one payload.
 */
final class AudioChunks {

    private AudioChunks() {
    }

    /**
     * Allocates one array sized to the sum of chunk lengths and copies each chunk at its
     * cumulative offset, preserving list order.
     */
    static byte[] concat(List<byte[]> chunks) {
        int total = 0;
        for (byte[] chunk : chunks) {
            total = Math.addExact(total, chunk.length);
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, out, offset, chunk.length);
            offset += chunk.length;
        }
        return out;
    }
}
