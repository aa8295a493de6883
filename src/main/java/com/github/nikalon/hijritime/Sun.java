package com.github.nikalon.hijritime;

/**
 * Low precision solar ephemeris, accurate to about an arc minute between 1950 and 2050.
 */
public final class Sun {
    // Acronyms used:
    // JD   Julian Date
    // RA   Right Ascension
    // EqT  Equation of Time

    static final double J2000 = 2451545.0;

    // Altitude of the centre of the Sun at sunrise and sunset: atmospheric refraction plus the solar radius
    static final double SUNRISE_ALTITUDE = -0.833;

    private Sun() {} // Disallow instantiation

    static double daysSinceJ2000(double julianDate) {
        return julianDate - J2000;
    }

    static double meanAnomaly(double D) {
        return Helper.fixAngle(357.529 + 0.98560028 * D);
    }

    static double meanLongitude(double D) {
        return Helper.fixAngle(280.459 + 0.98564736 * D);
    }

    static double eclipticLongitude(double D) {
        double g = meanAnomaly(D);
        double q = meanLongitude(D);
        return Helper.fixAngle(q + 1.915 * Helper.sin(g) + 0.020 * Helper.sin(2 * g));
    }

    static double obliquity(double D) {
        return 23.439 - 0.00000036 * D;
    }

    /**
     * Position of the Sun at the given Julian date.
     */
    public static SolarPosition position(double julianDate) {
        double D = daysSinceJ2000(julianDate);
        double q = meanLongitude(D);

        // The Sun always lies on the ecliptic (latitude 0)
        EclipticCoordinate eclCoord = new EclipticCoordinate(0, eclipticLongitude(D));
        EquatorialCoordinate eqCoord = eclCoord.toEquatorial(obliquity(D));

        // Mean longitude and RA wrap around at different moments, keep EqT close to zero
        double equationOfTime = Helper.modulo(q / 15.0 - eqCoord.rightAscension + 12.0, 24.0) - 12.0;

        return new SolarPosition(eqCoord.declination, equationOfTime, eqCoord.rightAscension);
    }

    /**
     * Hour angle at which the Sun reaches the given altitude.
     *
     * @param altitude    altitude of the Sun above the horizon in degrees, negative below it
     * @param latitude    latitude of the observer in degrees
     * @param declination declination of the Sun in degrees
     * @return hour angle in hours, between 0 and 12
     * @throws SunNeverReachesAngleException if the Sun stays above or below that altitude all day
     */
    static double hourAngle(double altitude, double latitude, double declination) throws SunNeverReachesAngleException {
        double hourAngleCosine = (Helper.sin(altitude) - Helper.sin(latitude) * Helper.sin(declination)) /
                                 (Helper.cos(latitude) * Helper.cos(declination));

        if (hourAngleCosine > 1 || hourAngleCosine < -1 || Double.isNaN(hourAngleCosine)) {
            throw new SunNeverReachesAngleException(altitude, latitude, declination);
        }

        return Helper.arccos(hourAngleCosine) / 15.0;
    }

    /**
     * Altitude of the Sun when the shadow of an object equals its noon shadow plus {@code shadowFactor} times its
     * length.
     */
    static double shadowAltitude(double shadowFactor, double latitude, double declination) {
        return Math.toDegrees(Math.atan(1.0 / (shadowFactor + Helper.tan(Math.abs(latitude - declination)))));
    }
}
