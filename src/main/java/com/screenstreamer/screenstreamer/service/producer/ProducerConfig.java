package com.screenstreamer.screenstreamer.service.producer;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Invocation parameters for one capture producer run.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ProducerConfig {

    /** Executable path, a name on the PATH, or {@code bundled}. */
    @Builder.Default
    private final String executable = "ffmpeg";

    /** Grab device format; null picks the platform default. */
    private final String inputFormat;

    /** Grab input (display, screen index); null picks the platform default. */
    private final String input;

    @Builder.Default
    private final int frameRate = 15;

    /** MJPEG quantizer, 2 (best) to 31 (worst). */
    @Builder.Default
    private final int quality = 5;

    /** Output width in pixels, aspect ratio kept; 0 keeps the source size. */
    @Builder.Default
    private final int scaleWidth = 0;

    @Builder.Default
    private final String quitSignal = "q";

    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(2);
}
