package com.github.nikalon.hijritime;

/**
 * Thrown when the Sun never reaches a given altitude on a given day at a given latitude, like the twilight
 * angles during a high latitude summer or the horizon during a polar night.
 */
class SunNeverReachesAngleException extends Exception {
    public SunNeverReachesAngleException(double altitude, double latitude, double declination) {
        super(String.format("The Sun never reaches an altitude of %.3f° at latitude %.4f° (declination %.4f°)",
                altitude, latitude, declination));
    }
}
