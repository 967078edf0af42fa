package com.screenstreamer.screenstreamer.service.preview;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import javax.imageio.ImageIO;

import org.springframework.stereotype.Component;

import com.screenstreamer.screenstreamer.service.frame.Frame;

/**
 * Keeps the last decoded preview image so it can be fetched over HTTP.
 */
@Component
public class LatestPreviewHolder implements PreviewListener {

    private final AtomicReference<Preview> latest = new AtomicReference<>();

    @Override
    public void onPreview(BufferedImage image, Frame source) {
        latest.set(new Preview(image, source.getSequence()));
    }

    @Override
    public void onSessionEnded() {
        latest.set(null);
    }

    public Preview getLatest() {
        return latest.get();
    }

    /**
     * @return the latest preview as JPEG bytes, or null if there is none
     */
    public byte[] encodeLatestAsJpeg() throws IOException {
        Preview preview = latest.get();
        if (preview == null) {
            return null;
        }
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(preview.image, "jpg", baos)) {
            throw new IOException("No JPEG writer available");
        }
        return baos.toByteArray();
    }

    public static final class Preview {
        private final BufferedImage image;
        private final long sequence;

        Preview(BufferedImage image, long sequence) {
            this.image = image;
            this.sequence = sequence;
        }

        public BufferedImage getImage() {
            return image;
        }

        public long getSequence() {
            return sequence;
        }
    }
}
