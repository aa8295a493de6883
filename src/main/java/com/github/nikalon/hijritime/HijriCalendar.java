package com.github.nikalon.hijritime;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Tabular (civil) Hijri calendar with the 30-year intercalary cycle {2, 5, 7, 10, 13, 16, 18, 21, 24, 26, 29}.
 *
 * <p>An instance binds a day-count adjustment that is added when converting Gregorian to Hijri and subtracted
 * in the other direction, so both directions stay inverses of each other. Instances are immutable and can be
 * shared between threads. See {@link HijriAdjustment} for the process-wide setting.
 */
public final class HijriCalendar {
    private static final int[] INTERCALARY_YEARS = {2, 5, 7, 10, 13, 16, 18, 21, 24, 26, 29};

    // 1 Muharram 1 AH. The year, month and day terms of hijriToJulianDate() add up to 385 for that date.
    private static final long EPOCH_DAY_NUMBER = 1948440;
    private static final int CYCLE_YEARS = 30;
    private static final int CYCLE_DAYS = 10631;

    private static final HijriCalendar UNADJUSTED = new HijriCalendar(0);

    private final int adjustment;

    private HijriCalendar(int adjustment) {
        this.adjustment = adjustment;
    }

    public static HijriCalendar unadjusted() {
        return UNADJUSTED;
    }

    public static HijriCalendar withAdjustment(int days) {
        return days == 0 ? UNADJUSTED : new HijriCalendar(days);
    }

    public int getAdjustment() {
        return adjustment;
    }

    public static boolean isLeapYear(int year) {
        int positionInCycle = Math.floorMod(year - 1, CYCLE_YEARS) + 1;
        for (int leapPosition : INTERCALARY_YEARS) {
            if (leapPosition == positionInCycle) return true;
        }
        return false;
    }

    /**
     * Odd months have 30 days and even months 29, except the last month of a leap year which has 30.
     *
     * @return the number of days of the month, or 0 if the month is not between 1 and 12
     */
    public static int monthLength(int year, int month) {
        if (month < 1 || month > 12) return 0;
        if (month % 2 == 1) return 30;
        if (month == 12 && isLeapYear(year)) return 30;
        return 29;
    }

    public static int yearLength(int year) {
        return isLeapYear(year) ? 355 : 354;
    }

    public static double hijriToJulianDate(int year, int month, int day) {
        return Math.floorDiv(11L * year + 3, CYCLE_YEARS)
                + 354L * year
                + 30L * month
                - Math.floorDiv(month - 1, 2)
                + day
                + EPOCH_DAY_NUMBER - 385;
    }

    public static HijriDate julianDateToHijri(double julianDate) {
        long L = JulianDay.dayNumber(julianDate) - EPOCH_DAY_NUMBER + 10632;
        long N = Math.floorDiv(L - 1, CYCLE_DAYS); // 30-year cycle
        long L2 = L - CYCLE_DAYS * N + 354;

        // Year within the cycle
        long J = Math.floorDiv(10985 - L2, 5316) * Math.floorDiv(50 * L2, 17719)
                + Math.floorDiv(L2, 5670) * Math.floorDiv(43 * L2, 15238);

        // Remaining days of the year
        L2 = L2 - Math.floorDiv(30 - J, 15) * Math.floorDiv(17719 * J, 50)
                - Math.floorDiv(J, 16) * Math.floorDiv(15238 * J, 43)
                + 29;

        long month = Math.floorDiv(24 * L2, 709);
        long day = L2 - Math.floorDiv(709 * month, 24);
        long year = 30 * N + J - 30;

        return new HijriDate((int) year, (int) month, (int) day);
    }

    public HijriDate gregorianToHijri(int year, int month, int day) {
        double julianDate = JulianDay.gregorianToJulianDate(year, month, day) + adjustment;
        return julianDateToHijri(julianDate);
    }

    public HijriDate gregorianToHijri(GregorianDate date) {
        return gregorianToHijri(date.year, date.month, date.day);
    }

    public HijriDate gregorianToHijri(LocalDate date) {
        return gregorianToHijri(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public GregorianDate hijriToGregorian(int year, int month, int day) {
        double julianDate = hijriToJulianDate(year, month, day) - adjustment;
        return JulianDay.julianDateToGregorian(julianDate);
    }

    public GregorianDate hijriToGregorian(HijriDate date) {
        return hijriToGregorian(date.year, date.month, date.day);
    }

    /**
     * @return day of the week, 0 = Sunday, 1 = Monday, ..., 6 = Saturday
     */
    public int dayOfWeek(int year, int month, int day) {
        double julianDate = hijriToJulianDate(year, month, day) - adjustment;
        return (int) Math.floorMod((long) Math.floor(julianDate + 1.5), 7L);
    }

    public int dayOfWeek(HijriDate date) {
        return dayOfWeek(date.year, date.month, date.day);
    }

    public HijriDate today(Clock clock) {
        return gregorianToHijri(LocalDate.now(clock));
    }

    @Override
    public String toString() {
        return String.format("HijriCalendar[adjustment=%+d]", adjustment);
    }
}
