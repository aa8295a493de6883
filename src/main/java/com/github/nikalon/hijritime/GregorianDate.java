package com.github.nikalon.hijritime;

import java.time.LocalDate;
import java.time.Year;
import java.util.Objects;

/**
 * A date of the Gregorian calendar (Julian calendar before 1582 October 15). No data validation is performed by
 * the constructor, use {@link #isValid()} when the values come from user input.
 */
public final class GregorianDate {
    public final int year;
    public final int month;
    public final int day;

    public GregorianDate(int year, int month, int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static GregorianDate of(LocalDate date) {
        return new GregorianDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public boolean isValid() {
        if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) return false;
        if (month < 1 || month > 12 || day < 1) return false;
        return day <= LocalDate.of(year, month, 1).lengthOfMonth();
    }

    /**
     * Converts this date to a {@link LocalDate}. Dates before the Gregorian reform are returned as the proleptic
     * Gregorian date with the same fields, so only use it for dates from 1582 October 15 onwards.
     *
     * @throws java.time.DateTimeException if the fields do not form a valid date
     */
    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GregorianDate)) return false;
        GregorianDate other = (GregorianDate) o;
        return year == other.year && month == other.month && day == other.day;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02d", year, month, day);
    }
}
