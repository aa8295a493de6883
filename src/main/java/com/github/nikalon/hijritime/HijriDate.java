package com.github.nikalon.hijritime;

import java.util.Objects;

/**
 * A date of the tabular Hijri calendar. No data validation is performed by the constructor, use
 * {@link #isValid()} when the values come from user input.
 */
public final class HijriDate {
    public final int year;
    public final int month;
    public final int day;

    public HijriDate(int year, int month, int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public boolean isValid() {
        return day >= 1 && day <= HijriCalendar.monthLength(year, month);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HijriDate)) return false;
        HijriDate other = (HijriDate) o;
        return year == other.year && month == other.month && day == other.day;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02d AH", year, month, day);
    }
}
