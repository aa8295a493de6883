package com.github.nikalon.hijritime;

/**
 * Direction of the Kaaba in Mecca.
 */
public final class Qibla {
    public static final GeographicCoordinate KAABA = GeographicCoordinate.fromDecimalDegrees(21.4225, 39.8262);

    private Qibla() {} // Disallow instantiation

    /**
     * Initial great circle bearing from the given location to the Kaaba.
     *
     * @return degrees clockwise from true north, in [0, 360)
     */
    public static double bearing(GeographicCoordinate from) {
        double deltaLongitude = KAABA.longitude - from.longitude;
        double y = Helper.sin(deltaLongitude);
        double x = Helper.cos(from.latitude) * Helper.tan(KAABA.latitude) -
                   Helper.sin(from.latitude) * Helper.cos(deltaLongitude);
        return Helper.fixAngle(Helper.arctan2(y, x));
    }
}
