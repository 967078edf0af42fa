package com.screenstreamer.screenstreamer.service.producer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class FFmpegCommandBuilderTest {

    private final FFmpegCommandBuilder builder = new FFmpegCommandBuilder();

    @Test
    void linuxGrabsX11DisplayAndWritesMjpegToStdout() {
        List<String> command = builder.build("ffmpeg", ProducerConfig.builder().build(), "Linux");

        assertEquals("ffmpeg", command.get(0));
        assertSequence(command, "-f", "x11grab", "-i", ":0.0");
        assertSequence(command, "-vf", "fps=15");
        assertSequence(command, "-q:v", "5", "-f", "mjpeg", "-");
        assertEquals("-", command.get(command.size() - 1));
    }

    @Test
    void windowsUsesGdigrabDesktop() {
        List<String> command = builder.build("ffmpeg.exe", ProducerConfig.builder().build(), "Windows 11");

        assertSequence(command, "-f", "gdigrab", "-framerate", "15", "-i", "desktop");
    }

    @Test
    void macUsesAvfoundation() {
        List<String> command = builder.build("ffmpeg", ProducerConfig.builder().build(), "Mac OS X");

        assertSequence(command, "-f", "avfoundation");
    }

    @Test
    void scaleWidthAddsScaleFilterAfterFps() {
        ProducerConfig config = ProducerConfig.builder().frameRate(10).quality(3).scaleWidth(1280).build();

        List<String> command = builder.build("ffmpeg", config, "Linux");

        assertSequence(command, "-vf", "fps=10,scale=1280:-1");
        assertSequence(command, "-q:v", "3");
    }

    @Test
    void explicitInputOverridesPlatformDefault() {
        ProducerConfig config = ProducerConfig.builder().inputFormat("x11grab").input(":1.0+100,200").build();

        List<String> command = builder.build("ffmpeg", config, "Linux");

        assertSequence(command, "-i", ":1.0+100,200");
    }

    @Test
    void rejectsOutOfRangeQuality() {
        ProducerConfig config = ProducerConfig.builder().quality(1).build();

        assertThrows(IllegalArgumentException.class, () -> builder.build("ffmpeg", config, "Linux"));
    }

    @Test
    void rejectsZeroFrameRate() {
        ProducerConfig config = ProducerConfig.builder().frameRate(0).build();

        assertThrows(IllegalArgumentException.class, () -> builder.build("ffmpeg", config, "Linux"));
    }

    private static void assertSequence(List<String> command, String... expected) {
        int start = command.indexOf(expected[0]);
        while (start >= 0) {
            if (start + expected.length <= command.size()
                    && command.subList(start, start + expected.length).equals(List.of(expected))) {
                return;
            }
            int next = command.subList(start + 1, command.size()).indexOf(expected[0]);
            start = next < 0 ? -1 : start + 1 + next;
        }
        fail("Expected " + List.of(expected) + " in " + command);
    }
}
