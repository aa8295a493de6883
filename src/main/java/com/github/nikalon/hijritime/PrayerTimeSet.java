package com.github.nikalon.hijritime;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The eight instants of one day. Immutable.
 */
public final class PrayerTimeSet {
    // Instants considered by nextPrayer(), in chronological order. Tahajjud is checked last because it falls
    // after midnight.
    private static final List<Prayer> DAY_SEQUENCE = List.of(
            Prayer.SEHRI, Prayer.FAJR, Prayer.SUNRISE, Prayer.DHUHR, Prayer.ASR, Prayer.MAGHRIB, Prayer.ISHA);

    private final Map<Prayer, PrayerTime> times;

    PrayerTimeSet(Map<Prayer, PrayerTime> times) {
        EnumMap<Prayer, PrayerTime> copy = new EnumMap<>(Prayer.class);
        for (Prayer prayer : Prayer.values()) {
            PrayerTime time = times.get(prayer);
            copy.put(prayer, time == null ? PrayerTime.undefined() : time);
        }
        this.times = Collections.unmodifiableMap(copy);
    }

    public PrayerTime get(Prayer prayer) {
        return times.get(prayer);
    }

    public Map<Prayer, PrayerTime> asMap() {
        return times;
    }

    /**
     * Moves every defined instant by the same amount. Undefined instants stay undefined.
     */
    public PrayerTimeSet shift(double deltaHours) {
        if (deltaHours == 0) return this;
        EnumMap<Prayer, PrayerTime> shifted = new EnumMap<>(Prayer.class);
        times.forEach((prayer, time) -> shifted.put(prayer, time.plusHours(deltaHours)));
        return new PrayerTimeSet(shifted);
    }

    public PrayerTimeSet shift(TimeAdjustment adjustment) {
        return shift(adjustment.toHours());
    }

    /**
     * Finds the first instant strictly after {@code currentHour}, comparing raw values. After Isha this is
     * Tahajjud, and once Tahajjud has passed too it is tomorrow's Sehri, approximated by today's Sehri plus 24 hours.
     *
     * @return the next instant, or empty if none of the candidates is defined
     */
    public Optional<NextPrayer> nextPrayer(double currentHour) {
        for (Prayer prayer : DAY_SEQUENCE) {
            PrayerTime time = times.get(prayer);
            if (time.isAfter(currentHour)) {
                return Optional.of(new NextPrayer(prayer, time.rawHours().getAsDouble(), false));
            }
        }

        PrayerTime tahajjud = times.get(Prayer.TAHAJJUD);
        if (tahajjud.isAfter(currentHour)) {
            return Optional.of(new NextPrayer(Prayer.TAHAJJUD, tahajjud.rawHours().getAsDouble(), false));
        }

        PrayerTime sehri = times.get(Prayer.SEHRI);
        if (sehri.isDefined()) {
            return Optional.of(new NextPrayer(Prayer.SEHRI, sehri.rawHours().getAsDouble() + 24, true));
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrayerTimeSet)) return false;
        return times.equals(((PrayerTimeSet) o).times);
    }

    @Override
    public int hashCode() {
        return times.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        times.forEach((prayer, time) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(prayer.getKey()).append('=').append(time.to24HourString());
        });
        return sb.toString();
    }
}
