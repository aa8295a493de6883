package com.github.nikalon.hijritime;

import java.util.List;
import java.util.Objects;

/**
 * Fires once per prayer when the clock enters the minute that starts at the prayer time. Meant to be polled from a
 * clock loop, e.g. every second. Not thread safe: use one instance per loop.
 */
public final class PrayerAlarm {
    // Prayers that trigger a notification. Sehri, Sunrise and Tahajjud are informative only.
    static final List<Prayer> ALARM_PRAYERS = List.of(Prayer.FAJR, Prayer.DHUHR, Prayer.ASR, Prayer.MAGHRIB, Prayer.ISHA);

    private static final double TRIGGER_WINDOW_MINUTES = 1.0;

    // The memory of the last notification is cleared when the clock goes past midnight
    private static final double MIDNIGHT_RESET_HOURS = 0.01;

    private final Listener listener;
    private Prayer lastNotified;

    public PrayerAlarm(Listener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @param times       today's prayer times, already shifted by any manual adjustment
     * @param currentHour current local time in decimal hours
     */
    public void check(PrayerTimeSet times, double currentHour) {
        for (Prayer prayer : ALARM_PRAYERS) {
            var time = times.get(prayer).decimalHours();
            if (time.isEmpty()) continue;

            double minutesSincePrayer = (currentHour - time.getAsDouble()) * 60;
            if (minutesSincePrayer >= 0 && minutesSincePrayer < TRIGGER_WINDOW_MINUTES && lastNotified != prayer) {
                lastNotified = prayer;
                listener.onPrayerTime(prayer, times.get(prayer));
            }
        }

        if (currentHour < MIDNIGHT_RESET_HOURS) {
            lastNotified = null;
        }
    }

    Prayer getLastNotified() {
        return lastNotified;
    }

    public interface Listener {
        void onPrayerTime(Prayer prayer, PrayerTime time);
    }
}
