package com.screenstreamer.screenstreamer.service.preview;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.screenstreamer.screenstreamer.service.frame.Frame;

/**
 * Decodes frames for the preview off the capture thread, one at a time.
 * A frame offered while a decode is running is dropped for preview only.
 */
public class PreviewDecoder implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PreviewDecoder.class);

    private final int targetWidth;
    private final PreviewListener listener;
    private final Semaphore permit = new Semaphore(1);
    private final ExecutorService executor;

    private final AtomicLong decoded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public PreviewDecoder(int targetWidth, PreviewListener listener, String threadName) {
        if (targetWidth <= 0) {
            throw new IllegalArgumentException("preview width must be positive: " + targetWidth);
        }
        this.targetWidth = targetWidth;
        this.listener = listener;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return true if a decode was scheduled, false if the frame was dropped
     */
    public boolean offer(Frame frame) {
        if (!permit.tryAcquire()) {
            dropped.incrementAndGet();
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    decodeAndNotify(frame);
                } finally {
                    permit.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            permit.release();
            dropped.incrementAndGet();
            logger.debug("Preview decoder shut down, dropping {}", frame);
            return false;
        }
    }

    private void decodeAndNotify(Frame frame) {
        try {
            BufferedImage image = decode(frame);
            decoded.incrementAndGet();
            listener.onPreview(image, frame);
        } catch (Exception e) {
            failed.incrementAndGet();
            logger.warn("Preview decode failed for {}: {}", frame, e.getMessage());
        }
    }

    BufferedImage decode(Frame frame) throws IOException {
        BufferedImage original;
        try (InputStream in = frame.openStream()) {
            original = ImageIO.read(in);
        }
        if (original == null) {
            throw new IOException("not a decodable image");
        }
        return scaleToWidth(original, targetWidth);
    }

    static BufferedImage scaleToWidth(BufferedImage original, int width) {
        if (width <= 0 || original.getWidth() <= width) {
            return original;
        }
        int height = Math.max(1, (int) Math.round(original.getHeight() * (width / (double) original.getWidth())));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(original, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    public long getDecodedCount() {
        return decoded.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("Preview decoder did not stop within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        listener.onSessionEnded();
    }
}
