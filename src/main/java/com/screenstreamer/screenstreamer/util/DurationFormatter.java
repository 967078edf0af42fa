package com.screenstreamer.screenstreamer.util;

import java.time.Duration;

public final class DurationFormatter {

    private DurationFormatter() {}

    /**
     * Short uptime text: "42s", "3m 12s", "1h 5m", "2d 4h".
     */
    public static String humanize(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        if (seconds < 60) {
            return seconds + "s";
        }

        long mins = seconds / 60;
        if (mins < 60) {
            return mins + "m " + (seconds % 60) + "s";
        }

        long hours = mins / 60;
        if (hours < 24) {
            return hours + "h " + (mins % 60) + "m";
        }

        long days = hours / 24;
        return days + "d " + (hours % 24) + "h";
    }
}
