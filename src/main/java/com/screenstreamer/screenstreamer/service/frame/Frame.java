package com.screenstreamer.screenstreamer.service.frame;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * One complete JPEG image cut out of the producer stream.
 * Immutable: the bytes are copied in and never handed out directly.
 */
public final class Frame {

    private final byte[] data;
    private final long sequence;
    private final long capturedAtMillis;

    Frame(byte[] source, int offset, int length, long sequence) {
        this.data = Arrays.copyOfRange(source, offset, offset + length);
        this.sequence = sequence;
        this.capturedAtMillis = System.currentTimeMillis();
    }

    public static Frame of(byte[] jpeg, long sequence) {
        return new Frame(jpeg, 0, jpeg.length, sequence);
    }

    public int length() {
        return data.length;
    }

    /**
     * 1-based position of this frame in its session's stream.
     */
    public long getSequence() {
        return sequence;
    }

    public long getCapturedAtMillis() {
        return capturedAtMillis;
    }

    public void writeTo(OutputStream out) throws IOException {
        out.write(data);
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "Frame{seq=" + sequence + ", bytes=" + data.length + "}";
    }
}
