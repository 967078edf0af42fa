package com.screenstreamer.screenstreamer.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import com.screenstreamer.screenstreamer.service.producer.ProducerConfig;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings under the {@code screenstreamer} prefix in application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "screenstreamer")
public class ScreenStreamerProperties {

    /** Start a capture session as soon as the application is ready. */
    private boolean autoStart = false;

    private final Producer producer = new Producer();
    private final Scanner scanner = new Scanner();
    private final Stream stream = new Stream();
    private final Preview preview = new Preview();

    @Getter
    @Setter
    public static class Producer {
        private String executable = "ffmpeg";
        private String inputFormat;
        private String input;
        private int frameRate = 15;
        private int quality = 5;
        private int scaleWidth = 0;
        private String quitSignal = "q";
        private Duration shutdownTimeout = Duration.ofSeconds(2);
        private int readBufferSize = 4096;

        public ProducerConfig toProducerConfig() {
            return ProducerConfig.builder()
                    .executable(executable)
                    .inputFormat(inputFormat)
                    .input(input)
                    .frameRate(frameRate)
                    .quality(quality)
                    .scaleWidth(scaleWidth)
                    .quitSignal(quitSignal)
                    .shutdownTimeout(shutdownTimeout)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Scanner {
        /** Accumulated bytes without a frame boundary before the buffer is dropped. */
        private DataSize maxBufferSize = DataSize.ofMegabytes(10);
    }

    @Getter
    @Setter
    public static class Stream {
        private String boundary = "frame";
        /** Minimum time between two parts sent to one viewer. */
        private Duration minInterval = Duration.ofMillis(66);
        /** Sleep between checks while a viewer waits for its next tick or first frame. */
        private Duration pollInterval = Duration.ofMillis(10);
        private int maxConnections = 256;
    }

    @Getter
    @Setter
    public static class Preview {
        private boolean enabled = true;
        private int width = 800;
    }
}
