package com.github.nikalon.hijritime;

import java.util.Locale;

/**
 * The eight daily instants, in the order they are displayed.
 */
public enum Prayer {
    SEHRI("Sehri"),
    FAJR("Fajr"),
    SUNRISE("Sunrise"),
    DHUHR("Dhuhr"),
    ASR("Asr"),
    MAGHRIB("Maghrib"),
    ISHA("Isha"),
    TAHAJJUD("Tahajjud");

    private final String displayName;

    Prayer(String displayName) {
        this.displayName = displayName;
    }

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }
}
