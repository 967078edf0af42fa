package com.screenstreamer.screenstreamer.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class DurationFormatterTest {

    @Test
    void formatsEachRange() {
        assertEquals("0s", DurationFormatter.humanize(Duration.ZERO));
        assertEquals("42s", DurationFormatter.humanize(Duration.ofSeconds(42)));
        assertEquals("3m 12s", DurationFormatter.humanize(Duration.ofSeconds(192)));
        assertEquals("1h 5m", DurationFormatter.humanize(Duration.ofMinutes(65)));
        assertEquals("2d 4h", DurationFormatter.humanize(Duration.ofHours(52)));
    }

    @Test
    void negativeDurationsClampToZero() {
        assertEquals("0s", DurationFormatter.humanize(Duration.ofSeconds(-5)));
    }
}
