package com.screenstreamer.screenstreamer.service.preview;

import java.awt.image.BufferedImage;

import com.screenstreamer.screenstreamer.service.frame.Frame;

/**
 * Receives decoded, downscaled frames for display. Called on the decoder thread.
 */
public interface PreviewListener {

    void onPreview(BufferedImage image, Frame source);

    default void onSessionEnded() {
    }
}
