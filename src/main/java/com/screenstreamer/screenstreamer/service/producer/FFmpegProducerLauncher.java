package com.screenstreamer.screenstreamer.service.producer;

import java.util.List;

import org.bytedeco.javacpp.Loader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Starts FFmpeg as the capture producer.
 */
@Component
@RequiredArgsConstructor
public class FFmpegProducerLauncher implements ProducerLauncher {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegProducerLauncher.class);

    static final String BUNDLED = "bundled";

    private final FFmpegCommandBuilder commandBuilder;

    @Override
    public ProducerPipe launch(ProducerConfig config) throws LaunchException {
        String executable = resolveExecutable(config.getExecutable());
        List<String> command;
        try {
            command = commandBuilder.build(executable, config);
        } catch (IllegalArgumentException e) {
            throw new LaunchException("Invalid producer configuration: " + e.getMessage(), e);
        }
        logger.info("Launching capture: {}", String.join(" ", command));
        return SubprocessPipe.start(command, config.getQuitSignal());
    }

    /**
     * {@code bundled} extracts the ffmpeg binary packaged with the bytedeco
     * ffmpeg artifacts; anything else is used as given.
     */
    String resolveExecutable(String configured) throws LaunchException {
        if (configured == null || configured.trim().isEmpty()) {
            return "ffmpeg";
        }
        if (!BUNDLED.equalsIgnoreCase(configured.trim())) {
            return configured.trim();
        }
        try {
            String path = Loader.load(org.bytedeco.ffmpeg.ffmpeg.class);
            logger.debug("Using bundled ffmpeg at {}", path);
            return path;
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            throw new LaunchException("Bundled ffmpeg is not available for this platform", e);
        }
    }
}
