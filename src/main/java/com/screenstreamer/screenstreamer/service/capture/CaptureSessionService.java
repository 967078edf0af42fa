package com.screenstreamer.screenstreamer.service.capture;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.screenstreamer.screenstreamer.config.ScreenStreamerProperties;
import com.screenstreamer.screenstreamer.model.SessionState;
import com.screenstreamer.screenstreamer.model.dto.SessionStatus;
import com.screenstreamer.screenstreamer.model.dto.StartSessionRequest;
import com.screenstreamer.screenstreamer.service.frame.AtomicFrameStore;
import com.screenstreamer.screenstreamer.service.preview.PreviewDecoder;
import com.screenstreamer.screenstreamer.service.preview.PreviewListener;
import com.screenstreamer.screenstreamer.service.producer.LaunchException;
import com.screenstreamer.screenstreamer.service.producer.ProducerConfig;
import com.screenstreamer.screenstreamer.service.producer.ProducerLauncher;
import com.screenstreamer.screenstreamer.service.producer.ProducerPipe;
import com.screenstreamer.screenstreamer.service.stream.StreamBroadcastService;
import com.screenstreamer.screenstreamer.util.DurationFormatter;

import jakarta.annotation.PreDestroy;

/**
 * Starts and stops the single capture session.
 */
@Service
public class CaptureSessionService {

    private static final Logger logger = LoggerFactory.getLogger(CaptureSessionService.class);

    // extra time for the capture thread after the producer is gone
    private static final long JOIN_GRACE_MS = 1000;

    private final ProducerLauncher launcher;
    private final PreviewListener previewListener;
    private final StreamBroadcastService broadcastService;
    private final ScreenStreamerProperties properties;

    private final AtomicInteger sessionCounter = new AtomicInteger();

    private volatile CaptureSession current;
    private volatile String lastLaunchError;

    public CaptureSessionService(ProducerLauncher launcher, PreviewListener previewListener,
                                 StreamBroadcastService broadcastService, ScreenStreamerProperties properties) {
        this.launcher = launcher;
        this.previewListener = previewListener;
        this.broadcastService = broadcastService;
        this.properties = properties;
    }

    public SessionStatus startSession(StartSessionRequest request) throws LaunchException {
        ProducerConfig config = mergeConfig(request);
        int previewWidth = request != null && request.getPreviewWidth() != null
                ? request.getPreviewWidth()
                : properties.getPreview().getWidth();
        return startSession(config, previewWidth);
    }

    /**
     * Launches the producer and the capture thread.
     *
     * @throws IllegalStateException if a session is already running
     * @throws LaunchException if the producer cannot be started
     */
    public synchronized SessionStatus startSession(ProducerConfig config, int previewWidth) throws LaunchException {
        CaptureSession existing = current;
        if (existing != null && existing.isActive()) {
            throw new IllegalStateException("Capture session " + existing.getId() + " is already running");
        }
        if (existing != null) {
            // previous run ended on its own; make sure it is fully cleaned up
            existing.release();
        }

        String id = "session-" + sessionCounter.incrementAndGet();
        int readBufferSize = properties.getProducer().getReadBufferSize();
        int maxBufferBytes;
        ProducerPipe pipe;
        try {
            maxBufferBytes = maxBufferBytes();
            if (readBufferSize <= 0) {
                throw new LaunchException("screenstreamer.producer.read-buffer-size must be positive: " + readBufferSize);
            }
            pipe = launcher.launch(config);
        } catch (LaunchException e) {
            lastLaunchError = e.getMessage();
            current = null;
            logger.error("Could not start capture session {}: {}", id, e.getMessage());
            throw e;
        }

        PreviewDecoder previewDecoder = null;
        CaptureSession session;
        try {
            if (properties.getPreview().isEnabled()) {
                previewDecoder = new PreviewDecoder(previewWidth, previewListener, "preview-" + id);
            }
            session = new CaptureSession(id, config, pipe, new AtomicFrameStore(), previewDecoder);
            CaptureLoop loop = new CaptureLoop(session, readBufferSize, maxBufferBytes, this::onCaptureEnded);
            Thread thread = new Thread(loop, "capture-" + id);
            session.setCaptureThread(thread);
            thread.start();
        } catch (RuntimeException e) {
            abortSetup(id, pipe, previewDecoder, config, e);
            throw new LaunchException(lastLaunchError, e);
        } catch (Error e) {
            abortSetup(id, pipe, previewDecoder, config, e);
            throw e;
        }
        lastLaunchError = null;
        current = session;

        logger.info("Capture session {} started (pid {})", id, pipe.pid());
        return status();
    }

    /**
     * Stops the current session if there is one. When this returns the producer
     * process is no longer running and every viewer has been told to leave.
     */
    public synchronized SessionStatus stopSession() {
        CaptureSession session = current;
        if (session == null || isFinished(session.getState())) {
            return status();
        }

        logger.info("Stopping capture session {}", session.getId());
        session.requestStop();
        broadcastService.closeSubscribers(session.getId());

        Duration timeout = session.getConfig().getShutdownTimeout();
        session.getPipe().requestStop(timeout);

        Thread thread = session.getCaptureThread();
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(timeout.toMillis() + JOIN_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                logger.warn("Capture thread {} still running after stop, interrupting", thread.getName());
                thread.interrupt();
            }
        }

        session.finish(SessionState.STOPPED, null);
        session.release();
        logger.info("Capture session {} stopped after {} frames", session.getId(), session.getFramesCaptured());
        return status();
    }

    /**
     * The producer is already running when setup fails, and no session owns it yet.
     */
    private void abortSetup(String id, ProducerPipe pipe, PreviewDecoder previewDecoder,
                            ProducerConfig config, Throwable cause) {
        pipe.requestStop(config.getShutdownTimeout());
        if (previewDecoder != null) {
            previewDecoder.close();
        }
        lastLaunchError = "Capture setup failed: " + cause.getMessage();
        current = null;
        logger.error("Could not set up capture session {}, producer stopped", id, cause);
    }

    private static boolean isFinished(SessionState state) {
        return state == SessionState.STOPPED || state == SessionState.COMPLETED || state == SessionState.FAILED;
    }

    private void onCaptureEnded(CaptureSession session) {
        broadcastService.closeSubscribers(session.getId());
        if (!session.isStopRequested()) {
            // producer went away by itself, nobody else will clean up
            session.release();
        }
    }

    /**
     * @return the running session, or null
     */
    public CaptureSession getActiveSession() {
        CaptureSession session = current;
        return session != null && session.isActive() ? session : null;
    }

    public SessionStatus status() {
        CaptureSession session = current;
        if (session == null) {
            return SessionStatus.builder()
                    .state(lastLaunchError != null ? SessionState.FAILED : SessionState.IDLE)
                    .activeViewers(broadcastService.getActiveCount())
                    .lastError(lastLaunchError)
                    .build();
        }

        PreviewDecoder preview = session.getPreviewDecoder();
        SessionStatus.SessionStatusBuilder builder = SessionStatus.builder()
                .state(session.getState())
                .sessionId(session.getId())
                .framesCaptured(session.getFramesCaptured())
                .desyncCount(session.getDesyncCount())
                .bytesRead(session.getBytesRead())
                .previewDecoded(preview != null ? preview.getDecodedCount() : 0)
                .previewDropped(preview != null ? preview.getDroppedCount() : 0)
                .activeViewers(broadcastService.getActiveCount())
                .startedAt(session.getStartedAt().toString())
                .lastError(session.getLastError());
        if (session.isActive()) {
            builder.uptime(DurationFormatter.humanize(Duration.between(session.getStartedAt(), Instant.now())));
            builder.pid(session.getPipe().pid());
        }
        return builder.build();
    }

    ProducerConfig mergeConfig(StartSessionRequest request) {
        ProducerConfig defaults = properties.getProducer().toProducerConfig();
        if (request == null) {
            return defaults;
        }
        ProducerConfig.ProducerConfigBuilder builder = defaults.toBuilder();
        if (request.getFrameRate() != null) {
            builder.frameRate(request.getFrameRate());
        }
        if (request.getQuality() != null) {
            builder.quality(request.getQuality());
        }
        if (request.getScaleWidth() != null) {
            builder.scaleWidth(request.getScaleWidth());
        }
        if (request.getInput() != null && !request.getInput().trim().isEmpty()) {
            builder.input(request.getInput().trim());
        }
        return builder.build();
    }

    private int maxBufferBytes() throws LaunchException {
        long bytes = properties.getScanner().getMaxBufferSize().toBytes();
        if (bytes <= 0 || bytes > Integer.MAX_VALUE - 8) {
            throw new LaunchException("screenstreamer.scanner.max-buffer-size out of range: " + bytes);
        }
        return (int) bytes;
    }

    @PreDestroy
    public void shutdown() {
        if (current != null) {
            stopSession();
        }
    }
}
