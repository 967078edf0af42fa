package com.screenstreamer.screenstreamer.service.frame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a concatenated MJPEG byte stream into frames, whatever the chunking.
 *
 * Bytes are appended to an accumulation buffer and searched for the JPEG
 * end-of-image marker (0xFF 0xD9). Every marker closes a frame that starts right
 * after the previous one. Only the unconsumed tail survives a call.
 *
 * Any 0xFF 0xD9 pair counts as a boundary, including one that happens to appear
 * inside entropy-coded data. The stream is not parsed as JPEG, so such a pair
 * splits the image in two.
 *
 * Not thread safe: one scanner belongs to one capture loop.
 */
public class FrameBoundaryScanner {

    private static final Logger logger = LoggerFactory.getLogger(FrameBoundaryScanner.class);

    public static final int DEFAULT_MAX_BUFFER_BYTES = 10 * 1024 * 1024;

    private static final int INITIAL_CAPACITY = 64 * 1024;
    private static final byte MARKER_FIRST = (byte) 0xFF;
    private static final byte MARKER_SECOND = (byte) 0xD9;

    private final int maxBufferBytes;
    private final FrameScanListener listener;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;
    // bytes already checked as the second half of a marker
    private int scanned;

    private long framesEmitted;
    private long desyncCount;

    public FrameBoundaryScanner(FrameScanListener listener) {
        this(DEFAULT_MAX_BUFFER_BYTES, listener);
    }

    public FrameBoundaryScanner(int maxBufferBytes, FrameScanListener listener) {
        if (maxBufferBytes <= 0) {
            throw new IllegalArgumentException("maxBufferBytes must be positive: " + maxBufferBytes);
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        this.maxBufferBytes = maxBufferBytes;
        this.listener = listener;
    }

    public void accept(byte[] chunk) {
        accept(chunk, 0, chunk.length);
    }

    /**
     * Appends one raw chunk and emits every frame it completes, in stream order.
     */
    public void accept(byte[] chunk, int offset, int count) {
        if (count <= 0) {
            return;
        }
        ensureCapacity(length + count);
        System.arraycopy(chunk, offset, buffer, length, count);
        length += count;

        int consumed = 0;
        // start one byte back so a marker split across two chunks is still seen
        for (int i = Math.max(1, scanned); i < length; i++) {
            if (buffer[i - 1] == MARKER_FIRST && buffer[i] == MARKER_SECOND) {
                int end = i + 1;
                Frame frame = new Frame(buffer, consumed, end - consumed, ++framesEmitted);
                consumed = end;
                listener.onFrame(frame);
            }
        }
        scanned = length;

        if (consumed > 0) {
            compact(consumed);
        }

        if (length > maxBufferBytes) {
            discard();
        }
    }

    private void compact(int consumed) {
        int remaining = length - consumed;
        System.arraycopy(buffer, consumed, buffer, 0, remaining);
        length = remaining;
        scanned -= consumed;
    }

    private void discard() {
        int dropped = length;
        desyncCount++;
        length = 0;
        scanned = 0;
        if (buffer.length > INITIAL_CAPACITY * 4) {
            buffer = new byte[INITIAL_CAPACITY];
        }
        logger.debug("Discarded {} bytes without a frame boundary", dropped);
        listener.onDesync(new StreamDesyncException(dropped, maxBufferBytes));
    }

    private void ensureCapacity(int needed) {
        if (needed <= buffer.length) {
            return;
        }
        int newCapacity = Math.max(needed, buffer.length * 2);
        byte[] grown = new byte[newCapacity];
        System.arraycopy(buffer, 0, grown, 0, length);
        buffer = grown;
    }

    public int getBufferedBytes() {
        return length;
    }

    public long getFramesEmitted() {
        return framesEmitted;
    }

    public long getDesyncCount() {
        return desyncCount;
    }

    public int getMaxBufferBytes() {
        return maxBufferBytes;
    }
}
