package com.github.nikalon.hijritime;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeAdjustmentTest {
    @Test
    void parseTest() {
        assertEquals(Optional.of(TimeAdjustment.of(false, 2, 30)), TimeAdjustment.parse("+02:30"));
        assertEquals(Optional.of(TimeAdjustment.of(false, 2, 30)), TimeAdjustment.parse("2:30"));
        assertEquals(Optional.of(TimeAdjustment.of(true, 1, 5)), TimeAdjustment.parse(" -01:05 "));
        assertEquals(Optional.of(TimeAdjustment.NONE), TimeAdjustment.parse("00:00"));
        assertEquals(Optional.of(TimeAdjustment.NONE), TimeAdjustment.parse("-00:00"));
    }

    @Test
    void parseInvalidTest() {
        assertTrue(TimeAdjustment.parse(null).isEmpty());
        assertTrue(TimeAdjustment.parse("").isEmpty());
        assertTrue(TimeAdjustment.parse("5").isEmpty());
        assertTrue(TimeAdjustment.parse("60:00").isEmpty());
        assertTrue(TimeAdjustment.parse("00:75").isEmpty());
        assertTrue(TimeAdjustment.parse("1:2:3").isEmpty());
        assertTrue(TimeAdjustment.parse("*01:00").isEmpty());
    }

    @Test
    void clampTest() {
        assertEquals(TimeAdjustment.of(false, 59, 0), TimeAdjustment.of(false, 120, 0));
        assertEquals(TimeAdjustment.of(true, 0, 59), TimeAdjustment.of(true, -3, 61));
    }

    @Test
    void toHoursTest() {
        assertEquals(2.5 / 60, TimeAdjustment.of(false, 2, 30).toHours(), 1e-12);
        assertEquals(-(1 / 60.0 + 5 / 3600.0), TimeAdjustment.of(true, 1, 5).toHours(), 1e-12);
        assertEquals(0.0, TimeAdjustment.NONE.toHours());
        assertTrue(TimeAdjustment.NONE.isZero());
        assertFalse(TimeAdjustment.of(true, 0, 1).isZero());
    }

    @Test
    void toStringTest() {
        assertEquals("+00:00", TimeAdjustment.NONE.toString());
        assertEquals("-01:05", TimeAdjustment.of(true, 1, 5).toString());
        assertEquals("+10:00", TimeAdjustment.of(false, 10, 0).toString());
        assertEquals("+00:00", TimeAdjustment.of(true, 0, 0).toString());
    }
}
