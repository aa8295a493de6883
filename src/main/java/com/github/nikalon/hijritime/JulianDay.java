package com.github.nikalon.hijritime;

/**
 * Conversions between calendar dates and Julian dates (JD), shared by the Hijri calendar and the solar position
 * calculations. A calendar date converts to the JD of its civil midnight, which always ends in {@code .5}.
 */
public final class JulianDay {
    // First day of the Gregorian calendar (1582 October 15) as an integer day number
    static final long GREGORIAN_REFORM_DAY_NUMBER = 2299161;

    private JulianDay() {} // Disallow instantiation

    /**
     * Gregorian (or Julian, before the 1582 reform) calendar date to Julian date. No era validation is performed,
     * negative and proleptic years are computed arithmetically.
     */
    public static double gregorianToJulianDate(int year, int month, int day) {
        int yearP = year;
        int monthP = month;

        if (month <= 2) {
            yearP = year - 1;
            monthP = month + 12;
        }

        double julianCalendarDate = Math.floor(365.25 * (yearP + 4716)) + Math.floor(30.6001 * (monthP + 1)) + day - 1524.5;

        // Century correction, only for dates after the Gregorian reform
        long A = Math.floorDiv(yearP, 100);
        long B = 2 - A + Math.floorDiv(A, 4);
        double gregorianDate = julianCalendarDate + B;
        if (dayNumber(gregorianDate) >= GREGORIAN_REFORM_DAY_NUMBER) {
            return gregorianDate;
        } else {
            return julianCalendarDate;
        }
    }

    public static double gregorianToJulianDate(GregorianDate date) {
        return gregorianToJulianDate(date.year, date.month, date.day);
    }

    public static GregorianDate julianDateToGregorian(double julianDate) {
        long Z = dayNumber(julianDate);

        long A;
        if (Z < GREGORIAN_REFORM_DAY_NUMBER) {
            A = Z;
        } else {
            long alpha = (long) Math.floor((Z - 1867216.25) / 36524.25);
            A = Z + 1 + alpha - Math.floorDiv(alpha, 4);
        }

        long B = A + 1524;
        long C = (long) Math.floor((B - 122.1) / 365.25);
        long D = (long) Math.floor(365.25 * C);
        long E = (long) Math.floor((B - D) / 30.6001);

        int day = (int) (B - D - (long) Math.floor(30.6001 * E));
        int month = (int) (E < 14 ? E - 1 : E - 13);
        int year = (int) (month > 2 ? C - 4716 : C - 4715);

        return new GregorianDate(year, month, day);
    }

    /**
     * Integer day number of the civil day that contains the given Julian date. Both the JD of civil midnight
     * ({@code N - 0.5}) and the JD of noon ({@code N}) of the same day map to {@code N}.
     */
    public static long dayNumber(double julianDate) {
        return (long) Math.floor(julianDate + 0.5);
    }
}
