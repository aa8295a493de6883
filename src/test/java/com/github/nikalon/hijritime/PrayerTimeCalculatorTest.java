package com.github.nikalon.hijritime;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrayerTimeCalculatorTest {
    private static final GeographicCoordinate MECCA = GeographicCoordinate.fromDecimalDegrees(21.4225, 39.8262);
    private static final GeographicCoordinate KARACHI = GeographicCoordinate.fromDecimalDegrees(24.8607, 67.0011);
    private static final GeographicCoordinate NEW_YORK = GeographicCoordinate.fromDecimalDegrees(40.7128, -74.0060);
    private static final double EPSILON = 1e-6;

    private static double raw(PrayerTimeSet times, Prayer prayer) {
        return times.get(prayer).rawHours().getAsDouble();
    }

    @Test
    void meccaGoldenValuesTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII);
        PrayerTimeSet times = calculator.calculate(LocalDate.of(2024, 1, 1), MECCA, 3);

        assertEquals("05:29", times.get(Prayer.SEHRI).to24HourString());
        assertEquals("05:39", times.get(Prayer.FAJR).to24HourString());
        assertEquals("06:58", times.get(Prayer.SUNRISE).to24HourString());
        assertEquals("12:24", times.get(Prayer.DHUHR).to24HourString());
        assertEquals("15:28", times.get(Prayer.ASR).to24HourString());
        assertEquals("17:49", times.get(Prayer.MAGHRIB).to24HourString());
        assertEquals("19:04", times.get(Prayer.ISHA).to24HourString());
        assertEquals("01:42", times.get(Prayer.TAHAJJUD).to24HourString());

        assertEquals("5:39 AM", times.get(Prayer.FAJR).to12HourString());
        assertEquals("12:24 PM", times.get(Prayer.DHUHR).to12HourString());
        assertEquals("7:04 PM", times.get(Prayer.ISHA).to12HourString());
        assertEquals("1:42 AM", times.get(Prayer.TAHAJJUD).to12HourString());

        assertEquals(5.651593636086378, raw(times, Prayer.FAJR), EPSILON);
        assertEquals(12.396466051205051, raw(times, Prayer.DHUHR), EPSILON);
        assertEquals(15.472490258719041, raw(times, Prayer.ASR), EPSILON);
        assertEquals(17.821255371822318, raw(times, Prayer.MAGHRIB), EPSILON);
        // Raw Tahajjud is past midnight, the decimal value is folded back into the day
        assertEquals(25.708147547998358, raw(times, Prayer.TAHAJJUD), EPSILON);
        assertEquals(1.708147547998358, times.get(Prayer.TAHAJJUD).decimalHours().getAsDouble(), EPSILON);
    }

    @Test
    void otherMethodsGoldenValuesTest() {
        var karachi = new PrayerTimeCalculator(CalculationMethod.KARACHI, AsrConvention.HANAFI)
                .calculate(2024, 3, 20, KARACHI, 5);
        assertEquals("05:20", karachi.get(Prayer.FAJR).to24HourString());
        assertEquals("06:36", karachi.get(Prayer.SUNRISE).to24HourString());
        assertEquals("12:39", karachi.get(Prayer.DHUHR).to24HourString());
        assertEquals("17:01", karachi.get(Prayer.ASR).to24HourString());
        assertEquals("18:43", karachi.get(Prayer.MAGHRIB).to24HourString());
        assertEquals("19:59", karachi.get(Prayer.ISHA).to24HourString());

        var newYork = new PrayerTimeCalculator(CalculationMethod.ISNA, AsrConvention.SHAFII)
                .calculate(2024, 12, 21, NEW_YORK, -5);
        assertEquals("05:54", newYork.get(Prayer.FAJR).to24HourString());
        assertEquals("07:17", newYork.get(Prayer.SUNRISE).to24HourString());
        assertEquals("11:54", newYork.get(Prayer.DHUHR).to24HourString());
        assertEquals("14:14", newYork.get(Prayer.ASR).to24HourString());
        assertEquals("16:32", newYork.get(Prayer.MAGHRIB).to24HourString());
        assertEquals("17:54", newYork.get(Prayer.ISHA).to24HourString());
    }

    @Test
    void fixedIshaIntervalTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MAKKAH, AsrConvention.HANAFI);
        PrayerTimeSet times = calculator.calculate(2024, 6, 21, MECCA, 3);

        assertEquals(raw(times, Prayer.MAGHRIB) + 1.5, raw(times, Prayer.ISHA), EPSILON);
        assertEquals("04:11", times.get(Prayer.FAJR).to24HourString());
        assertEquals("17:01", times.get(Prayer.ASR).to24HourString());
        assertEquals("19:06", times.get(Prayer.MAGHRIB).to24HourString());
        assertEquals("20:36", times.get(Prayer.ISHA).to24HourString());
    }

    @Test
    void orderingInMeccaDuring2024Test() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII);
        for (LocalDate date = LocalDate.of(2024, 1, 1); date.getYear() == 2024; date = date.plusDays(1)) {
            PrayerTimeSet times = calculator.calculate(date, MECCA, 3);
            Prayer[] order = {Prayer.SEHRI, Prayer.FAJR, Prayer.SUNRISE, Prayer.DHUHR, Prayer.ASR, Prayer.MAGHRIB, Prayer.ISHA};
            for (int i = 1; i < order.length; i++) {
                double before = raw(times, order[i - 1]);
                double after = raw(times, order[i]);
                assertTrue(before < after, String.format("%s: %s (%f) should be before %s (%f)", date, order[i - 1], before, order[i], after));
            }
            assertTrue(raw(times, Prayer.TAHAJJUD) > raw(times, Prayer.ISHA));
        }
    }

    @Test
    void sehriIsTenMinutesBeforeFajrTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.EGYPT, AsrConvention.SHAFII);
        PrayerTimeSet times = calculator.calculate(2024, 4, 1, MECCA, 3);
        assertEquals(raw(times, Prayer.FAJR) - 10.0 / 60.0, raw(times, Prayer.SEHRI), EPSILON);
    }

    @Test
    void tahajjudIsLastThirdOfTheNightTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII);
        PrayerTimeSet times = calculator.calculate(2024, 4, 1, MECCA, 3);
        double maghrib = raw(times, Prayer.MAGHRIB);
        double night = raw(times, Prayer.FAJR) + 24 - maghrib;
        assertEquals(maghrib + night * 2.0 / 3.0, raw(times, Prayer.TAHAJJUD), EPSILON);
    }

    @Test
    void hanafiAsrIsLaterTest() {
        LocalDate date = LocalDate.of(2024, 9, 15);
        PrayerTimeSet shafii = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII).calculate(date, KARACHI, 5);
        PrayerTimeSet hanafi = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.HANAFI).calculate(date, KARACHI, 5);

        assertTrue(raw(hanafi, Prayer.ASR) > raw(shafii, Prayer.ASR));
        assertEquals(raw(shafii, Prayer.FAJR), raw(hanafi, Prayer.FAJR));
        assertEquals(raw(shafii, Prayer.ISHA), raw(hanafi, Prayer.ISHA));
    }

    @Test
    void largerTwilightAngleMeansEarlierFajrTest() {
        LocalDate date = LocalDate.of(2024, 5, 1);
        PrayerTimeSet isna = new PrayerTimeCalculator(CalculationMethod.ISNA, AsrConvention.SHAFII).calculate(date, NEW_YORK, -4);
        PrayerTimeSet egypt = new PrayerTimeCalculator(CalculationMethod.EGYPT, AsrConvention.SHAFII).calculate(date, NEW_YORK, -4);

        assertTrue(raw(egypt, Prayer.FAJR) < raw(isna, Prayer.FAJR));
        assertTrue(raw(egypt, Prayer.ISHA) > raw(isna, Prayer.ISHA));
    }

    @Test
    void highLatitudeSummerIsUndefinedTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII);
        GeographicCoordinate tromso = GeographicCoordinate.fromDecimalDegrees(70, 20);
        PrayerTimeSet times = calculator.calculate(2024, 6, 21, tromso, 2);

        assertTrue(!times.get(Prayer.FAJR).isDefined() || !times.get(Prayer.ISHA).isDefined());

        // Midnight sun: no sunrise, no sunset and nothing derived from them
        assertFalse(times.get(Prayer.FAJR).isDefined());
        assertFalse(times.get(Prayer.SUNRISE).isDefined());
        assertFalse(times.get(Prayer.MAGHRIB).isDefined());
        assertFalse(times.get(Prayer.ISHA).isDefined());
        assertFalse(times.get(Prayer.SEHRI).isDefined());
        assertFalse(times.get(Prayer.TAHAJJUD).isDefined());
        assertEquals(PrayerTime.UNDEFINED_TIME, times.get(Prayer.FAJR).to24HourString());
        assertEquals(PrayerTime.UNDEFINED_TIME, times.get(Prayer.FAJR).to12HourString());

        // Noon and Asr still exist
        assertEquals("12:42", times.get(Prayer.DHUHR).to24HourString());
        assertEquals("17:55", times.get(Prayer.ASR).to24HourString());
    }

    @Test
    void fixedIshaIntervalIsUndefinedWithoutSunsetTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.MAKKAH, AsrConvention.SHAFII);
        PrayerTimeSet times = calculator.calculate(2024, 6, 21, GeographicCoordinate.fromDecimalDegrees(70, 20), 2);
        assertFalse(times.get(Prayer.MAGHRIB).isDefined());
        assertFalse(times.get(Prayer.ISHA).isDefined());
    }

    @Test
    void calculationIsDeterministicTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.KARACHI, AsrConvention.HANAFI);
        assertEquals(calculator.calculate(2024, 2, 2, KARACHI, 5), calculator.calculate(LocalDate.of(2024, 2, 2), KARACHI, 5));
        assertEquals(calculator.calculate(2024, 2, 2, KARACHI, 5), calculator.calculate(new GregorianDate(2024, 2, 2), KARACHI, 5));
    }

    @Test
    void fractionalUtcOffsetTest() {
        var calculator = new PrayerTimeCalculator(CalculationMethod.KARACHI, AsrConvention.SHAFII);
        GeographicCoordinate delhi = GeographicCoordinate.fromDecimalDegrees(28.6139, 77.2090);
        PrayerTimeSet atFive = calculator.calculate(2024, 2, 2, delhi, 5);
        PrayerTimeSet atFiveAndAHalf = calculator.calculate(2024, 2, 2, delhi, 5.5);
        for (Prayer prayer : Prayer.values()) {
            assertEquals(raw(atFive, prayer) + 0.5, raw(atFiveAndAHalf, prayer), EPSILON, prayer.getKey());
        }
    }

    @Test
    void nullArgumentsTest() {
        assertThrows(NullPointerException.class, () -> new PrayerTimeCalculator(null, AsrConvention.SHAFII));
        var calculator = new PrayerTimeCalculator(CalculationMethod.MWL, AsrConvention.SHAFII);
        assertThrows(NullPointerException.class, () -> calculator.calculate(2024, 1, 1, null, 3));
    }
}
