package com.screenstreamer.screenstreamer.service.capture;

import static com.screenstreamer.screenstreamer.support.JpegFixtures.concat;
import static com.screenstreamer.screenstreamer.support.JpegFixtures.realJpeg;
import static com.screenstreamer.screenstreamer.support.JpegFixtures.syntheticFrame;
import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.screenstreamer.screenstreamer.model.SessionState;
import com.screenstreamer.screenstreamer.service.frame.AtomicFrameStore;
import com.screenstreamer.screenstreamer.service.frame.Frame;
import com.screenstreamer.screenstreamer.service.frame.FrameStore;
import com.screenstreamer.screenstreamer.service.preview.PreviewDecoder;
import com.screenstreamer.screenstreamer.service.preview.PreviewListener;
import com.screenstreamer.screenstreamer.service.producer.PipeState;
import com.screenstreamer.screenstreamer.service.producer.ProducerConfig;
import com.screenstreamer.screenstreamer.support.InMemoryProducerPipe;

class CaptureLoopTest {

    /**
     * Remembers every frame published, in order.
     */
    private static class RecordingStore extends AtomicFrameStore {
        final List<Frame> published = new CopyOnWriteArrayList<>();

        @Override
        public void publish(Frame frame) {
            published.add(frame);
            super.publish(frame);
        }
    }

    private static CaptureSession session(InMemoryProducerPipe pipe, FrameStore store, PreviewDecoder preview) {
        return new CaptureSession("test", ProducerConfig.builder().shutdownTimeout(Duration.ofMillis(100)).build(),
                pipe, store, preview);
    }

    @Test
    void publishesFramesInStreamOrderAndCompletesOnEndOfStream() {
        InMemoryProducerPipe pipe = new InMemoryProducerPipe();
        RecordingStore store = new RecordingStore();
        CaptureSession session = session(pipe, store, null);
        AtomicInteger exits = new AtomicInteger();

        byte[] f1 = syntheticFrame(100, 1);
        byte[] f2 = syntheticFrame(150, 2);
        byte[] f3 = syntheticFrame(80, 3);
        byte[] stream = concat(f1, f2, f3);
        pipe.push(Arrays.copyOfRange(stream, 0, 70));
        pipe.push(Arrays.copyOfRange(stream, 70, 249));
        pipe.push(Arrays.copyOfRange(stream, 249, stream.length));
        pipe.finish();

        new CaptureLoop(session, 4096, 1024 * 1024, s -> exits.incrementAndGet()).run();

        assertEquals(3, store.published.size());
        assertArrayEquals(f1, store.published.get(0).toByteArray());
        assertArrayEquals(f2, store.published.get(1).toByteArray());
        assertArrayEquals(f3, store.published.get(2).toByteArray());
        assertEquals(SessionState.COMPLETED, session.getState());
        assertEquals(3, session.getFramesCaptured());
        assertEquals(stream.length, session.getBytesRead());
        assertEquals(1, exits.get());
        assertTrue(pipe.getStopRequests() >= 1, "producer must be stopped on exit");
    }

    @Test
    void desyncIsCountedAndCaptureContinues() {
        InMemoryProducerPipe pipe = new InMemoryProducerPipe();
        RecordingStore store = new RecordingStore();
        CaptureSession session = session(pipe, store, null);

        pipe.push(new byte[300]);
        pipe.push(new byte[300]);
        byte[] good = syntheticFrame(120, 5);
        pipe.push(good);
        pipe.finish();

        new CaptureLoop(session, 4096, 512, s -> { }).run();

        assertEquals(1, session.getDesyncCount());
        assertEquals(1, store.published.size());
        assertArrayEquals(good, store.published.get(0).toByteArray());
        assertEquals(SessionState.COMPLETED, session.getState());
    }

    @Test
    void stopRequestEndsTheLoopAsStopped() throws Exception {
        InMemoryProducerPipe pipe = new InMemoryProducerPipe();
        CaptureSession session = session(pipe, new AtomicFrameStore(), null);
        CountDownLatch exited = new CountDownLatch(1);

        Thread thread = new Thread(new CaptureLoop(session, 4096, 1024, s -> exited.countDown()));
        thread.start();
        pipe.push(syntheticFrame(50, 1));

        session.requestStop();
        pipe.requestStop(Duration.ofMillis(100));

        assertTrue(exited.await(5, TimeUnit.SECONDS));
        assertEquals(SessionState.STOPPED, session.getState());
        assertEquals(PipeState.EXITED, pipe.getState());
    }

    @Test
    void readFailureMarksSessionFailed() {
        InMemoryProducerPipe pipe = new InMemoryProducerPipe();
        CaptureSession session = session(pipe, new AtomicFrameStore(), null);
        pipe.failWith(new IOException("broken pipe"));

        new CaptureLoop(session, 4096, 1024, s -> { }).run();

        assertEquals(SessionState.FAILED, session.getState());
        assertTrue(session.getLastError().contains("broken pipe"));
    }

    @Test
    void previewGetsDecodedFramesButNeverBlocksPublishing() throws Exception {
        CountDownLatch firstPreview = new CountDownLatch(1);
        CountDownLatch releaseDecoder = new CountDownLatch(1);
        List<Long> previewed = new ArrayList<>();
        PreviewListener slowListener = (BufferedImage image, Frame source) -> {
            synchronized (previewed) {
                previewed.add(source.getSequence());
            }
            firstPreview.countDown();
            try {
                releaseDecoder.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        PreviewDecoder decoder = new PreviewDecoder(100, slowListener, "preview-test");
        InMemoryProducerPipe pipe = new InMemoryProducerPipe();
        RecordingStore store = new RecordingStore();
        CaptureSession session = session(pipe, store, decoder);

        byte[] jpeg = realJpeg(64, 48);
        pipe.push(jpeg);
        Thread thread = new Thread(new CaptureLoop(session, 64 * 1024, 1024 * 1024, s -> { }));
        thread.start();
        assertTrue(firstPreview.await(5, TimeUnit.SECONDS));

        // decoder is busy with frame 1: these are published but skipped for preview
        pipe.push(jpeg);
        pipe.push(jpeg);
        pipe.finish();
        thread.join(5000);

        assertEquals(3, store.published.size());
        assertEquals(2, decoder.getDroppedCount());
        releaseDecoder.countDown();
        decoder.close();
        synchronized (previewed) {
            assertEquals(List.of(1L), previewed);
        }
    }
}
