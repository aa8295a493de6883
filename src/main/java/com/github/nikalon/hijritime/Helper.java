package com.github.nikalon.hijritime;

class Helper {
    // Common functions used when performing astronomical calculations. All angles are in degrees.

    private Helper() {} // Disallow instantiation

    static double modulo(double dividend, double divisor) {
        // Modulo defined as floor division, where the sign is determined by the divisor. Math.floorMod only works
        // with integers, so we need our own version for doubles.
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    static double fixAngle(double degrees) {
        return modulo(degrees, 360.0);
    }

    static double fixHour(double hours) {
        return modulo(hours, 24.0);
    }

    static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    static double arcsin(double x) {
        return Math.toDegrees(Math.asin(x));
    }

    static double arccos(double x) {
        return Math.toDegrees(Math.acos(x));
    }

    static double arctan2(double y, double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }
}
