package com.github.nikalon.hijritime;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manual correction applied to every computed prayer time, e.g. to match the timetable of the local mosque.
 * Minutes and seconds are clamped to [0, 59].
 */
public final class TimeAdjustment {
    public static final TimeAdjustment NONE = new TimeAdjustment(false, 0, 0);

    // +MM:SS, -MM:SS or MM:SS
    private static final Pattern REGEX_ADJUSTMENT = Pattern.compile("(?<sign>[+-])?(?<minutes>\\d{1,2}):(?<seconds>\\d{1,2})");

    private final boolean negative;
    private final int minutes;
    private final int seconds;

    private TimeAdjustment(boolean negative, int minutes, int seconds) {
        this.negative = negative && (minutes != 0 || seconds != 0); // No "-00:00"
        this.minutes = minutes;
        this.seconds = seconds;
    }

    public static TimeAdjustment of(boolean negative, int minutes, int seconds) {
        return new TimeAdjustment(negative, clamp(minutes), clamp(seconds));
    }

    public static Optional<TimeAdjustment> parse(String text) {
        if (text == null) return Optional.empty();
        Matcher matcher = REGEX_ADJUSTMENT.matcher(text.trim());
        if (!matcher.matches()) return Optional.empty();

        boolean negative = "-".equals(matcher.group("sign"));
        int minutes = Integer.parseInt(matcher.group("minutes"));
        int seconds = Integer.parseInt(matcher.group("seconds"));
        if (minutes > 59 || seconds > 59) return Optional.empty();
        return Optional.of(of(negative, minutes, seconds));
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(59, value));
    }

    public double toHours() {
        double hours = minutes / 60.0 + seconds / 3600.0;
        return negative ? -hours : hours;
    }

    public boolean isZero() {
        return minutes == 0 && seconds == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeAdjustment)) return false;
        TimeAdjustment other = (TimeAdjustment) o;
        return negative == other.negative && minutes == other.minutes && seconds == other.seconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(negative, minutes, seconds);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s%02d:%02d", negative ? "-" : "+", minutes, seconds);
    }
}
