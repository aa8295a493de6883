package com.github.nikalon.hijritime;

/**
 * Apparent position of the Sun at a given Julian date, as needed by the prayer time calculations.
 */
public final class SolarPosition {
    /** Declination, in degrees. */
    public final double declination;

    /**
     * Equation of time (apparent minus mean solar time), in hours within [-12, 12) rather than [0, 24). Solar noon
     * is reduced modulo 24 hours, so prayer times do not depend on the range.
     */
    public final double equationOfTime;

    /** Right ascension, in hours within [0, 24). */
    public final double rightAscension;

    SolarPosition(double declination, double equationOfTime, double rightAscension) {
        this.declination = declination;
        this.equationOfTime = equationOfTime;
        this.rightAscension = rightAscension;
    }

    @Override
    public String toString() {
        return String.format("declination %.4f°, equation of time %.4f h, right ascension %.4f h",
                declination, equationOfTime, rightAscension);
    }
}
