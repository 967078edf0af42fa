package com.screenstreamer.screenstreamer.service.preview;

import static com.screenstreamer.screenstreamer.support.JpegFixtures.realJpeg;
import static com.screenstreamer.screenstreamer.support.JpegFixtures.syntheticFrame;
import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.screenstreamer.screenstreamer.service.frame.Frame;

class PreviewDecoderTest {

    @Test
    void decodesAndScalesToTargetWidth() throws Exception {
        AtomicReference<BufferedImage> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        PreviewDecoder decoder = new PreviewDecoder(100, (image, source) -> {
            received.set(image);
            done.countDown();
        }, "preview-test");

        try {
            assertTrue(decoder.offer(Frame.of(realJpeg(400, 300), 1)));
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            decoder.close();
        }

        assertEquals(100, received.get().getWidth());
        assertEquals(75, received.get().getHeight());
        assertEquals(1, decoder.getDecodedCount());
    }

    @Test
    void smallImagesAreNotUpscaled() throws Exception {
        PreviewDecoder decoder = new PreviewDecoder(800, (image, source) -> { }, "preview-test");
        try {
            BufferedImage image = decoder.decode(Frame.of(realJpeg(120, 90), 1));

            assertEquals(120, image.getWidth());
        } finally {
            decoder.close();
        }
    }

    @Test
    void undecodableBytesAreCountedNotThrown() throws Exception {
        CountDownLatch called = new CountDownLatch(1);
        PreviewDecoder decoder = new PreviewDecoder(100, (image, source) -> called.countDown(), "preview-test");

        try {
            decoder.offer(Frame.of(syntheticFrame(64, 1), 1));
            long deadline = System.currentTimeMillis() + 5000;
            while (decoder.getFailedCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
        } finally {
            decoder.close();
        }

        assertEquals(1, decoder.getFailedCount());
        assertEquals(1, called.getCount(), "listener must not see failed decodes");
    }

    @Test
    void offerWhileBusyIsDropped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PreviewDecoder decoder = new PreviewDecoder(100, (image, source) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "preview-test");

        try {
            byte[] jpeg = realJpeg(50, 50);
            assertTrue(decoder.offer(Frame.of(jpeg, 1)));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertFalse(decoder.offer(Frame.of(jpeg, 2)));
            assertEquals(1, decoder.getDroppedCount());

            release.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            boolean accepted = false;
            while (!accepted && System.currentTimeMillis() < deadline) {
                accepted = decoder.offer(Frame.of(jpeg, 3));
                if (!accepted) {
                    Thread.sleep(5);
                }
            }
            assertTrue(accepted, "permit should come back after the decode finishes");
        } finally {
            decoder.close();
        }
    }

    @Test
    void closeClearsLatestPreviewHolder() throws Exception {
        LatestPreviewHolder holder = new LatestPreviewHolder();
        PreviewDecoder decoder = new PreviewDecoder(100, holder, "preview-test");
        decoder.offer(Frame.of(realJpeg(200, 100), 7));
        long deadline = System.currentTimeMillis() + 5000;
        while (holder.getLatest() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(7, holder.getLatest().getSequence());
        assertNotNull(holder.encodeLatestAsJpeg());

        decoder.close();

        assertNull(holder.getLatest());
        assertNull(holder.encodeLatestAsJpeg());
    }
}
