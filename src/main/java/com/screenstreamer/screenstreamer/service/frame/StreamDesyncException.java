package com.screenstreamer.screenstreamer.service.frame;

/**
 * Reported (not thrown) by {@link FrameBoundaryScanner} when the accumulation
 * buffer outgrew its cap without a frame boundary and was discarded.
 */
public class StreamDesyncException extends RuntimeException {

    private final int discardedBytes;

    public StreamDesyncException(int discardedBytes, int maxBufferBytes) {
        super("No JPEG end-of-image marker in " + discardedBytes
                + " buffered bytes (cap " + maxBufferBytes + "), buffer discarded");
        this.discardedBytes = discardedBytes;
    }

    public int getDiscardedBytes() {
        return discardedBytes;
    }
}
