package com.screenstreamer.screenstreamer.service.producer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

/**
 * Builds the FFmpeg command line that grabs the desktop and writes MJPEG to stdout.
 */
@Component
public class FFmpegCommandBuilder {

    public List<String> build(String executable, ProducerConfig config) {
        return build(executable, config, System.getProperty("os.name", ""));
    }

    List<String> build(String executable, ProducerConfig config, String osName) {
        if (config.getFrameRate() <= 0) {
            throw new IllegalArgumentException("frameRate must be positive: " + config.getFrameRate());
        }
        if (config.getQuality() < 2 || config.getQuality() > 31) {
            throw new IllegalArgumentException("quality must be between 2 and 31: " + config.getQuality());
        }

        Platform platform = Platform.of(osName);
        List<String> command = new ArrayList<>();
        command.add(executable);

        // keep stderr down to warnings, it only goes to the log
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("warning");

        // Grab device
        command.add("-f");
        command.add(config.getInputFormat() != null ? config.getInputFormat() : platform.inputFormat);
        if (platform == Platform.WINDOWS || platform == Platform.MAC) {
            command.add("-framerate");
            command.add(Integer.toString(config.getFrameRate()));
        }
        command.add("-i");
        command.add(config.getInput() != null ? config.getInput() : platform.defaultInput);

        // Filters: rate first so scaling only runs on kept frames
        String filter = "fps=" + config.getFrameRate();
        if (config.getScaleWidth() > 0) {
            filter += ",scale=" + config.getScaleWidth() + ":-1";
        }
        command.add("-vf");
        command.add(filter);

        // Output
        command.add("-q:v");
        command.add(Integer.toString(config.getQuality()));
        command.add("-f");
        command.add("mjpeg");
        command.add("-");
        return command;
    }

    enum Platform {
        WINDOWS("gdigrab", "desktop"),
        MAC("avfoundation", "1:none"),
        LINUX("x11grab", ":0.0");

        private final String inputFormat;
        private final String defaultInput;

        Platform(String inputFormat, String defaultInput) {
            this.inputFormat = inputFormat;
            this.defaultInput = defaultInput;
        }

        static Platform of(String osName) {
            String os = osName.toLowerCase(Locale.ROOT);
            if (os.startsWith("windows")) {
                return WINDOWS;
            }
            if (os.contains("mac") || os.contains("darwin")) {
                return MAC;
            }
            return LINUX;
        }
    }
}
