package com.github.nikalon.hijritime;

class EclipticCoordinate {
    // WARNING! No data validation is performed
    public final double latitude;
    public final double longitude;

    public EclipticCoordinate(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public EquatorialCoordinate toEquatorial(double obliquityDeg) {
        double deltaDeg = Helper.arcsin(Helper.sin(latitude) * Helper.cos(obliquityDeg) +
                                        Helper.cos(latitude) * Helper.sin(obliquityDeg) * Helper.sin(longitude));

        double y = Helper.sin(longitude) * Helper.cos(obliquityDeg) -
                   Helper.tan(latitude) * Helper.sin(obliquityDeg);
        double x = Helper.cos(longitude);

        // atan2 already resolves the quadrant
        double alphaHours = Helper.fixHour(Helper.arctan2(y, x) / 15.0);
        return new EquatorialCoordinate(alphaHours, deltaDeg);
    }
}
