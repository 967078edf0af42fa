package com.screenstreamer.screenstreamer.service.stream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.screenstreamer.screenstreamer.service.frame.Frame;
import com.screenstreamer.screenstreamer.service.frame.FrameStore;

/**
 * One viewer of the MJPEG stream. Sends whatever frame is latest at each tick,
 * at most once per {@code minInterval}, until the viewer goes away, the
 * subscriber is closed or the capture session ends.
 */
public class StreamSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(StreamSubscriber.class);

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PART_HEADERS = "Content-Type: image/jpeg\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    private final String id;
    private final String sessionId;
    private final FrameStore frameStore;
    private final BooleanSupplier sessionActive;
    private final OutputStream out;
    private final byte[] boundaryLine;
    private final long minIntervalNanos;
    private final long pollMillis;

    private volatile boolean closed = false;
    private long lastSentNanos;
    private boolean sentAny = false;
    private long framesSent;
    private long lastSequenceSent;

    public StreamSubscriber(String id, String sessionId, FrameStore frameStore, BooleanSupplier sessionActive,
                            OutputStream out, String boundary, Duration minInterval, Duration pollInterval) {
        this.id = id;
        this.sessionId = sessionId;
        this.frameStore = frameStore;
        this.sessionActive = sessionActive;
        this.out = out;
        this.boundaryLine = ("--" + boundary + "\r\n").getBytes(StandardCharsets.US_ASCII);
        this.minIntervalNanos = minInterval.toNanos();
        this.pollMillis = Math.max(1, pollInterval.toMillis());
    }

    /**
     * Runs the pacing loop on the calling thread. Returns when the viewer
     * disconnects or the stream is shut down; write failures are not rethrown.
     */
    public void run() {
        try {
            while (!closed && sessionActive.getAsBoolean()) {
                if (sentAny) {
                    long sinceLast = System.nanoTime() - lastSentNanos;
                    if (sinceLast < minIntervalNanos) {
                        long waitMillis = Math.min(pollMillis, Math.max(1, (minIntervalNanos - sinceLast) / 1_000_000));
                        Thread.sleep(waitMillis);
                        continue;
                    }
                }

                Optional<Frame> frame = frameStore.snapshot();
                if (frame.isEmpty()) {
                    Thread.sleep(pollMillis);
                    continue;
                }

                writePart(frame.get());
                lastSentNanos = System.nanoTime();
                sentAny = true;
                framesSent++;
                lastSequenceSent = frame.get().getSequence();
            }
        } catch (IOException e) {
            logger.debug("Viewer {} disconnected: {}", id, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Viewer {} interrupted", id);
        }
        closed = true;
    }

    private void writePart(Frame frame) throws IOException {
        out.write(boundaryLine);
        out.write(PART_HEADERS);
        frame.writeTo(out);
        out.write(CRLF);
        out.flush();
    }

    /**
     * Makes the loop exit at its next tick. The output stream is closed as well
     * so a write stuck on a viewer that stopped reading fails right away.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.close();
        } catch (IOException e) {
            logger.debug("Closing output of viewer {} failed: {}", id, e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getFramesSent() {
        return framesSent;
    }

    public long getLastSequenceSent() {
        return lastSequenceSent;
    }
}
