package com.github.nikalon.hijritime;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Objects;

/**
 * Computes the daily prayer times for a location from the position of the Sun.
 *
 * <p>All times are decimal hours of the local clock given by the UTC offset. An instant that cannot be computed
 * because the Sun never reaches the required altitude (twilight at high latitudes in summer, sunrise during the
 * polar night) is returned as {@link PrayerTime#undefined()}, and so is any instant derived from it.
 *
 * <p>Instances are immutable and thread safe.
 */
public final class PrayerTimeCalculator {
    /** Sehri ends this many minutes before Fajr. */
    public static final double SEHRI_OFFSET_MINUTES = 10;

    /**
     * Tahajjud starts after this fraction of the night. The night is measured from Maghrib to the Fajr of the same
     * date, not the Fajr of the next morning.
     */
    public static final double TAHAJJUD_NIGHT_FRACTION = 2.0 / 3.0;

    private final CalculationMethod method;
    private final AsrConvention asrConvention;

    public PrayerTimeCalculator(CalculationMethod method, AsrConvention asrConvention) {
        this.method = Objects.requireNonNull(method, "method");
        this.asrConvention = Objects.requireNonNull(asrConvention, "asrConvention");
    }

    public CalculationMethod getMethod() {
        return method;
    }

    public AsrConvention getAsrConvention() {
        return asrConvention;
    }

    public PrayerTimeSet calculate(LocalDate date, GeographicCoordinate coordinate, double utcOffsetHours) {
        return calculate(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), coordinate, utcOffsetHours);
    }

    public PrayerTimeSet calculate(GregorianDate date, GeographicCoordinate coordinate, double utcOffsetHours) {
        return calculate(date.year, date.month, date.day, coordinate, utcOffsetHours);
    }

    public PrayerTimeSet calculate(int year, int month, int day, GeographicCoordinate coordinate, double utcOffsetHours) {
        Objects.requireNonNull(coordinate, "coordinate");
        double latitude = coordinate.latitude;

        // The civil date is used as is, at midnight. No conversion to UT is done besides the UTC offset below.
        double julianDate = JulianDay.gregorianToJulianDate(year, month, day);
        SolarPosition sun = Sun.position(julianDate);
        double declination = sun.declination;

        // Solar noon on the local clock
        double dhuhr = Helper.fixHour(12 - sun.equationOfTime) + utcOffsetHours - coordinate.longitude / 15.0;

        PrayerTime fajr = beforeNoon(dhuhr, -method.getFajrAngle(), latitude, declination);
        PrayerTime sunrise = beforeNoon(dhuhr, Sun.SUNRISE_ALTITUDE, latitude, declination);
        PrayerTime maghrib = afterNoon(dhuhr, Sun.SUNRISE_ALTITUDE, latitude, declination);

        PrayerTime isha;
        if (method.hasFixedIshaInterval()) {
            isha = maghrib.plusHours(method.getIshaMinutesAfterMaghrib() / 60.0);
        } else {
            isha = afterNoon(dhuhr, -method.getIshaAngle(), latitude, declination);
        }

        double asrAltitude = Sun.shadowAltitude(asrConvention.getShadowFactor(), latitude, declination);
        PrayerTime asr = afterNoon(dhuhr, asrAltitude, latitude, declination);

        PrayerTime sehri = fajr.plusHours(-SEHRI_OFFSET_MINUTES / 60.0);
        PrayerTime night = fajr.combine(maghrib, (f, m) -> Helper.fixHour(f + 24 - m));
        PrayerTime tahajjud = maghrib.combine(night, (m, n) -> m + n * TAHAJJUD_NIGHT_FRACTION);

        EnumMap<Prayer, PrayerTime> times = new EnumMap<>(Prayer.class);
        times.put(Prayer.SEHRI, sehri);
        times.put(Prayer.FAJR, fajr);
        times.put(Prayer.SUNRISE, sunrise);
        times.put(Prayer.DHUHR, PrayerTime.of(dhuhr));
        times.put(Prayer.ASR, asr);
        times.put(Prayer.MAGHRIB, maghrib);
        times.put(Prayer.ISHA, isha);
        times.put(Prayer.TAHAJJUD, tahajjud);
        return new PrayerTimeSet(times);
    }

    // Time before solar noon (Sun rising, counter-clockwise) at which the Sun is at the given altitude
    private static PrayerTime beforeNoon(double dhuhr, double altitude, double latitude, double declination) {
        try {
            return PrayerTime.of(dhuhr - Sun.hourAngle(altitude, latitude, declination));
        } catch (SunNeverReachesAngleException e) {
            return PrayerTime.undefined();
        }
    }

    // Time after solar noon (Sun setting, clockwise) at which the Sun is at the given altitude
    private static PrayerTime afterNoon(double dhuhr, double altitude, double latitude, double declination) {
        try {
            return PrayerTime.of(dhuhr + Sun.hourAngle(altitude, latitude, declination));
        } catch (SunNeverReachesAngleException e) {
            return PrayerTime.undefined();
        }
    }

    @Override
    public String toString() {
        return String.format("%s, %s Asr", method.getDisplayName(), asrConvention.getKey());
    }
}
