package com.neutrala.sandbox;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Collects process output up to a byte limit. Bytes past the limit are dropped.
 */
class CappedOutputSink {

    private final long maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private long totalSeen;

    CappedOutputSink(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    /**
     * Appends as much of the chunk as fits.
     *
     * @return false once the stream has gone past the limit
     */
    synchronized boolean write(byte[] chunk, int length) {
        long remaining = maxBytes - buffer.size();
        if (remaining > 0) {
            buffer.write(chunk, 0, (int) Math.min(remaining, length));
        }
        totalSeen += length;
        return totalSeen <= maxBytes;
    }

    synchronized long totalSeen() {
        return totalSeen;
    }

    synchronized String asString() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
