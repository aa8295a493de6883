package com.github.nikalon.hijritime;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Process-wide Hijri day-count adjustment. It is usually loaded once at startup from the user preferences and
 * may be changed at any time. Every reader gets an immutable {@link HijriCalendar} bound to the latest value, so
 * a conversion never mixes two different adjustments.
 */
public final class HijriAdjustment {
    private static final Logger LOGGER = Logger.getLogger(HijriAdjustment.class.getName());

    private final AtomicReference<HijriCalendar> calendar;

    public HijriAdjustment(int days) {
        this.calendar = new AtomicReference<>(HijriCalendar.withAdjustment(days));
    }

    public int get() {
        return calendar.get().getAdjustment();
    }

    public void set(int days) {
        calendar.set(HijriCalendar.withAdjustment(days));
    }

    /**
     * Sets the adjustment from its textual form. Anything that is not an integer is treated as 0.
     */
    public void set(String days) {
        set(parse(days));
    }

    public HijriCalendar calendar() {
        return calendar.get();
    }

    static int parse(String days) {
        if (days == null) return 0;
        try {
            return Integer.parseInt(days.trim());
        } catch (NumberFormatException e) {
            LOGGER.fine(String.format("Hijri adjustment \"%s\" is not an integer, using 0", days));
            return 0;
        }
    }

    @Override
    public String toString() {
        return String.format("%+d", get());
    }
}
