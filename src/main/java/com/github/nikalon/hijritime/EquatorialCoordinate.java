package com.github.nikalon.hijritime;

class EquatorialCoordinate {
    // WARNING! No data validation is performed
    public final double rightAscension; // In hours, [0, 24)
    public final double declination; // In degrees

    public EquatorialCoordinate(double rightAscension, double declination) {
        this.rightAscension = rightAscension;
        this.declination = declination;
    }
}
