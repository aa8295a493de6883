package com.github.nikalon.hijritime;

import java.util.Locale;

public final class Countdown {
    private Countdown() {} // Disallow instantiation

    // Time left from currentHour to targetHour as "Hh MMm SSs". A target earlier than the current hour is taken as
    // the same time on the next day.
    public static String format(double targetHour, double currentHour) {
        double diff = targetHour - currentHour;
        if (diff < 0) diff += 24;

        // Round to whole seconds before splitting, 0.1 h is 6 minutes and not 5 min 59.99 s
        long totalSeconds = Math.round(diff * 3600);
        long hours = totalSeconds / 3600;
        long minutes = totalSeconds % 3600 / 60;
        long seconds = totalSeconds % 60;

        return String.format(Locale.ROOT, "%dh %02dm %02ds", hours, minutes, seconds);
    }
}
