package com.screenstreamer.screenstreamer.service.capture;

import java.io.IOException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.screenstreamer.screenstreamer.model.SessionState;
import com.screenstreamer.screenstreamer.service.frame.Frame;
import com.screenstreamer.screenstreamer.service.frame.FrameBoundaryScanner;
import com.screenstreamer.screenstreamer.service.frame.FrameScanListener;
import com.screenstreamer.screenstreamer.service.frame.StreamDesyncException;
import com.screenstreamer.screenstreamer.service.producer.ProducerPipe;

/**
 * Producer output -> frame scanner -> latest-frame slot, on one dedicated thread.
 *
 * The loop ends when the producer closes its output, when the session is asked
 * to stop, or when reading fails. In every case the producer is stopped before
 * the exit callback runs.
 */
public class CaptureLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(CaptureLoop.class);

    private final CaptureSession session;
    private final int readBufferSize;
    private final FrameBoundaryScanner scanner;
    private final Consumer<CaptureSession> onExit;

    public CaptureLoop(CaptureSession session, int readBufferSize, int maxBufferBytes,
                       Consumer<CaptureSession> onExit) {
        this.session = session;
        this.readBufferSize = readBufferSize;
        this.onExit = onExit;
        this.scanner = new FrameBoundaryScanner(maxBufferBytes, new FrameScanListener() {
            @Override
            public void onFrame(Frame frame) {
                session.onFrame(frame);
            }

            @Override
            public void onDesync(StreamDesyncException e) {
                session.onDesync();
                logger.warn("Session {}: {}", session.getId(), e.getMessage());
            }
        });
    }

    @Override
    public void run() {
        ProducerPipe pipe = session.getPipe();
        byte[] buffer = new byte[readBufferSize];
        SessionState outcome = SessionState.STOPPED;
        String error = null;

        logger.info("Capture loop started for session {}", session.getId());
        try {
            while (!session.isStopRequested()) {
                int n = pipe.readChunk(buffer);
                if (n < 0) {
                    if (!session.isStopRequested()) {
                        outcome = SessionState.COMPLETED;
                        logger.info("Producer closed its output, session {} completed", session.getId());
                    }
                    break;
                }
                session.addBytesRead(n);
                scanner.accept(buffer, 0, n);
            }
        } catch (IOException e) {
            if (session.isStopRequested()) {
                logger.debug("Read interrupted by stop in session {}: {}", session.getId(), e.getMessage());
            } else {
                outcome = SessionState.FAILED;
                error = "Reading producer output failed: " + e.getMessage();
                logger.error("Reading producer output failed in session {}", session.getId(), e);
            }
        } catch (RuntimeException e) {
            outcome = SessionState.FAILED;
            error = "Capture loop error: " + e.getMessage();
            logger.error("Capture loop crashed in session {}", session.getId(), e);
        } finally {
            pipe.requestStop(session.getConfig().getShutdownTimeout());
            session.finish(outcome, error);
            logger.info("Capture loop for session {} ended: {} frames from {} bytes, {} desyncs",
                    session.getId(), scanner.getFramesEmitted(), session.getBytesRead(), scanner.getDesyncCount());
            try {
                onExit.accept(session);
            } catch (RuntimeException e) {
                logger.error("Session exit handler failed for {}", session.getId(), e);
            }
        }
    }

    FrameBoundaryScanner getScanner() {
        return scanner;
    }
}
