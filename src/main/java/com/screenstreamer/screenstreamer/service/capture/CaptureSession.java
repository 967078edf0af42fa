package com.screenstreamer.screenstreamer.service.capture;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.screenstreamer.screenstreamer.model.SessionState;
import com.screenstreamer.screenstreamer.service.frame.Frame;
import com.screenstreamer.screenstreamer.service.frame.FrameStore;
import com.screenstreamer.screenstreamer.service.preview.PreviewDecoder;
import com.screenstreamer.screenstreamer.service.producer.ProducerConfig;
import com.screenstreamer.screenstreamer.service.producer.ProducerPipe;

/**
 * Everything that lives for one capture run: producer pipe, stop flag,
 * latest-frame slot, optional preview decoder and counters.
 * Shared between the capture thread, the control thread and viewer threads.
 */
public class CaptureSession {

    private static final Logger logger = LoggerFactory.getLogger(CaptureSession.class);

    private final String id;
    private final ProducerConfig config;
    private final ProducerPipe pipe;
    private final FrameStore frameStore;
    private final PreviewDecoder previewDecoder;
    private final Instant startedAt = Instant.now();

    /**
     * Cancellation signal read by the capture loop and every viewer loop.
     */
    private volatile boolean shouldStop = false;
    private volatile SessionState state = SessionState.RUNNING;
    private volatile String lastError;
    private volatile Thread captureThread;

    private final AtomicLong framesCaptured = new AtomicLong();
    private final AtomicLong desyncCount = new AtomicLong();
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicBoolean released = new AtomicBoolean();

    public CaptureSession(String id, ProducerConfig config, ProducerPipe pipe,
                          FrameStore frameStore, PreviewDecoder previewDecoder) {
        this.id = id;
        this.config = config;
        this.pipe = pipe;
        this.frameStore = frameStore;
        this.previewDecoder = previewDecoder;
    }

    public boolean isActive() {
        return !shouldStop && state.isActive();
    }

    public boolean isStopRequested() {
        return shouldStop;
    }

    synchronized void requestStop() {
        shouldStop = true;
        if (state == SessionState.RUNNING) {
            state = SessionState.STOPPING;
        }
    }

    /**
     * Moves to a final state once; later calls keep the first outcome.
     */
    synchronized void finish(SessionState outcome, String error) {
        if (state == SessionState.RUNNING || state == SessionState.STOPPING) {
            state = outcome;
            if (error != null) {
                lastError = error;
            }
        }
    }

    void onFrame(Frame frame) {
        frameStore.publish(frame);
        framesCaptured.incrementAndGet();
        if (previewDecoder != null) {
            previewDecoder.offer(frame);
        }
    }

    void onDesync() {
        desyncCount.incrementAndGet();
    }

    void addBytesRead(int count) {
        bytesRead.addAndGet(count);
    }

    /**
     * Stops the producer and frees the preview worker and the frame slot. Idempotent.
     */
    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            pipe.close();
        } catch (Exception e) {
            logger.warn("Error closing producer for session {}: {}", id, e.getMessage());
        }
        if (previewDecoder != null) {
            try {
                previewDecoder.close();
            } catch (Exception e) {
                logger.warn("Error closing preview decoder for session {}: {}", id, e.getMessage());
            }
        }
        frameStore.clear();
        logger.debug("Session {} resources released", id);
    }

    public String getId() {
        return id;
    }

    public ProducerConfig getConfig() {
        return config;
    }

    public ProducerPipe getPipe() {
        return pipe;
    }

    public FrameStore getFrameStore() {
        return frameStore;
    }

    public PreviewDecoder getPreviewDecoder() {
        return previewDecoder;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public SessionState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    public long getFramesCaptured() {
        return framesCaptured.get();
    }

    public long getDesyncCount() {
        return desyncCount.get();
    }

    public long getBytesRead() {
        return bytesRead.get();
    }

    Thread getCaptureThread() {
        return captureThread;
    }

    void setCaptureThread(Thread captureThread) {
        this.captureThread = captureThread;
    }
}
