package com.github.nikalon.hijritime;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Latitude and longitude in decimal degrees. North and east are positive.
 */
public final class GeographicCoordinate {
    public final double latitude;
    public final double longitude;

    private GeographicCoordinate(double latitude, double longitude) {
        // Set as private constructor to disallow direct instantiation
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static GeographicCoordinate defaultCoordinate() {
        return new GeographicCoordinate(0.0, 0.0);
    }

    public static GeographicCoordinate fromDecimalDegrees(double latitude, double longitude) {
        return new GeographicCoordinate(latitude, longitude);
    }

    public static GeographicCoordinate fromSexagesimalDegrees(double northDegrees, double northArcMinutes, double northArcSeconds,
                                                              double eastDegrees, double eastArcMinutes, double eastArcSeconds) {
        // Convert sexagesimal degrees to decimal degrees
        double latitude = northDegrees + northArcMinutes/60.0d + northArcSeconds/3600.0d;
        double longitude = eastDegrees + eastArcMinutes/60.0d + eastArcSeconds/3600.0d;
        return GeographicCoordinate.fromDecimalDegrees(latitude, longitude);
    }

    public boolean isValid() {
        return latitude >= -90.0 && latitude <= 90.0 && longitude >= -180.0 && longitude <= 180.0;
    }

    /**
     * Rough UTC offset of the location, one hour per 15 degrees of longitude rounded to the nearest half hour.
     * Only a fallback for when the real offset is unknown, it ignores political time zones and daylight saving time.
     */
    public double estimatedUtcOffset() {
        return Math.round(longitude / 15.0 * 2.0) / 2.0;
    }

    @Override
    public String toString() {
        var fmt = new DecimalFormat("0.0#####", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        return String.format(Locale.ENGLISH, "%s, %s", fmt.format(latitude), fmt.format(longitude));
    }
}
