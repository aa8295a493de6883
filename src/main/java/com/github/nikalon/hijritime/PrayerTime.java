package com.github.nikalon.hijritime;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.DoubleBinaryOperator;

/**
 * A computed instant of the day in decimal hours of local clock time, or an undefined instant when the Sun
 * never reaches the required altitude at that latitude and date.
 *
 * <p>The raw value is kept as computed and may fall outside [0, 24): Tahajjud after midnight is 25.x and a
 * negative time shift may push Fajr below zero. The decimal value is the same instant folded into [0, 24).
 */
public final class PrayerTime {
    public static final String UNDEFINED_TIME = "--:--";

    private static final PrayerTime UNDEFINED = new PrayerTime(Double.NaN);
    private static final int MINUTES_IN_A_DAY = 1440;

    private final double hours; // NaN when undefined, never leaks out of this class

    private PrayerTime(double hours) {
        this.hours = hours;
    }

    public static PrayerTime of(double hours) {
        if (Double.isNaN(hours) || Double.isInfinite(hours)) return UNDEFINED;
        return new PrayerTime(hours);
    }

    public static PrayerTime undefined() {
        return UNDEFINED;
    }

    public boolean isDefined() {
        return !Double.isNaN(hours);
    }

    public OptionalDouble rawHours() {
        return isDefined() ? OptionalDouble.of(hours) : OptionalDouble.empty();
    }

    public OptionalDouble decimalHours() {
        return isDefined() ? OptionalDouble.of(Helper.fixHour(hours)) : OptionalDouble.empty();
    }

    /**
     * @return {@code true} if this instant is defined and its raw value is strictly later than {@code hour}
     */
    public boolean isAfter(double hour) {
        return isDefined() && hours > hour;
    }

    public PrayerTime plusHours(double deltaHours) {
        return isDefined() ? PrayerTime.of(hours + deltaHours) : UNDEFINED;
    }

    /**
     * Combines two instants with {@code operator}, the result is undefined if any of them is undefined.
     */
    PrayerTime combine(PrayerTime other, DoubleBinaryOperator operator) {
        if (!isDefined() || !other.isDefined()) return UNDEFINED;
        return PrayerTime.of(operator.applyAsDouble(hours, other.hours));
    }

    // Total minutes of the day, rounded to the nearest minute
    private int minuteOfDay() {
        long minutes = Math.round(Helper.fixHour(hours) * 60.0);
        return (int) Math.floorMod(minutes, (long) MINUTES_IN_A_DAY);
    }

    /**
     * @return the time as {@code HH:mm}, or {@value #UNDEFINED_TIME}
     */
    public String to24HourString() {
        if (!isDefined()) return UNDEFINED_TIME;
        int minuteOfDay = minuteOfDay();
        return String.format(Locale.ROOT, "%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }

    /**
     * @return the time as {@code h:mm AM} or {@code h:mm PM}, or {@value #UNDEFINED_TIME}
     */
    public String to12HourString() {
        if (!isDefined()) return UNDEFINED_TIME;
        int minuteOfDay = minuteOfDay();
        int hour = minuteOfDay / 60;
        int minute = minuteOfDay % 60;

        int hour12;
        if (hour == 0)      hour12 = 12;
        else if (hour > 12) hour12 = hour - 12;
        else                hour12 = hour;

        String meridiem = hour < 12 ? "AM" : "PM";
        return String.format(Locale.ROOT, "%d:%02d %s", hour12, minute, meridiem);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrayerTime)) return false;
        return Double.compare(hours, ((PrayerTime) o).hours) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(hours);
    }

    @Override
    public String toString() {
        return to24HourString();
    }
}
