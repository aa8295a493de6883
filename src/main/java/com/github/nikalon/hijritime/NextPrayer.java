package com.github.nikalon.hijritime;

import java.util.Locale;
import java.util.Objects;

/**
 * The next instant after a reference time of day. When {@link #isTomorrow()} is set the instant is tomorrow's
 * Sehri and {@link #getTime()} is expressed in hours from today's midnight, so it is 24 or more.
 */
public final class NextPrayer {
    private final Prayer prayer;
    private final double time;
    private final boolean tomorrow;

    NextPrayer(Prayer prayer, double time, boolean tomorrow) {
        this.prayer = prayer;
        this.time = time;
        this.tomorrow = tomorrow;
    }

    public Prayer getPrayer() {
        return prayer;
    }

    public double getTime() {
        return time;
    }

    public boolean isTomorrow() {
        return tomorrow;
    }

    public String countdownFrom(double currentHour) {
        return Countdown.format(time, currentHour);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NextPrayer)) return false;
        NextPrayer other = (NextPrayer) o;
        return prayer == other.prayer && Double.compare(time, other.time) == 0 && tomorrow == other.tomorrow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prayer, time, tomorrow);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s at %s%s", prayer.getDisplayName(), PrayerTime.of(time),
                tomorrow ? " (tomorrow)" : "");
    }
}
