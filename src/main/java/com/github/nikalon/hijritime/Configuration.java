package com.github.nikalon.hijritime;

import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * User preferences: location, clock offset, calculation conventions and manual adjustments. Setters validate their
 * input and return {@code false}, keeping the previous value, when it is invalid.
 */
public class Configuration {
    static final String LOCATION_DEFAULT = "21.4225, 39.8262"; // Mecca
    static final String UTC_OFFSET_AUTO = "auto";
    static final int HIJRI_ADJUSTMENT_DEFAULT = -1;
    private static final double UTC_OFFSET_MIN_VALUE = -12.0;
    private static final double UTC_OFFSET_MAX_VALUE = 14.0;
    private static final boolean DEBUG_MODE_DEFAULT = false;
    private static final Pattern REGEX_DECIMAL_DEGREES = Pattern.compile("(?<latitude>-?\\d+(?:\\.\\d+)?),?\\s+(?<longitude>-?\\d+(?:\\.\\d+)?)");
    private static final Pattern REGEX_SEXAGESIMAL_DEGREES = Pattern.compile("(?<LatDeg>\\d+)°(?: *(?<LatArcMin>\\d+)')?(?: *(?<LatArcSec>\\d+(?:\\.\\d+)?)\")? *(?<LatDirection>[NS]),?\\s+(?<LonDeg>\\d+)°(?: *(?<LonArcMin>\\d+)')?(?: *(?<LonArcSec>\\d+(?:\\.\\d+)?)\")? *(?<LonDirection>[EW])");

    // Keys of the configuration file
    static final String KEY_LOCATION = "location";
    static final String KEY_UTC_OFFSET = "utc_offset";
    static final String KEY_CALCULATION_METHOD = "calculation_method";
    static final String KEY_ASR_CONVENTION = "asr_convention";
    static final String KEY_HIJRI_ADJUSTMENT = "hijri_adjustment";
    static final String KEY_TIME_ADJUSTMENT = "time_adjustment";
    static final String KEY_DEBUG_MODE = "debug_mode";

    private final Logger logger;
    private String location;
    private GeographicCoordinate geographicCoordinates;
    private String utcOffset;
    private CalculationMethod calculationMethod;
    private AsrConvention asrConvention;
    private final HijriAdjustment hijriAdjustment;
    private TimeAdjustment timeAdjustment;
    private boolean debugMode;

    public Configuration(Logger logger) {
        this.logger = logger;
        this.location = LOCATION_DEFAULT;
        this.geographicCoordinates = parseLocationOption(this.location);
        this.utcOffset = UTC_OFFSET_AUTO;
        this.calculationMethod = CalculationMethod.DEFAULT;
        this.asrConvention = AsrConvention.DEFAULT;
        this.hijriAdjustment = new HijriAdjustment(HIJRI_ADJUSTMENT_DEFAULT);
        this.timeAdjustment = TimeAdjustment.NONE;
        this.debugMode = DEBUG_MODE_DEFAULT;
    }

    /**
     * Applies every option found in {@code properties}. Missing options keep their current value, invalid ones are
     * logged and keep their current value too.
     */
    public void load(Properties properties) {
        // Debug mode
        String debugVal = properties.getProperty(KEY_DEBUG_MODE);
        if (debugVal == null) {
            // Keep current value. No action is required.
        } else if (debugVal.trim().equalsIgnoreCase("true") || debugVal.trim().equalsIgnoreCase("false")) {
            setDebugMode(Boolean.parseBoolean(debugVal.trim()));
        } else {
            logger.severe("\"debug_mode\" value is invalid, using default value. Please, use a boolean value (true or false).");
        }

        if (getDebugMode()) {
            logger.warning("debug mode is enabled. To disable debug mode set the option \"debug_mode\" to false.");
        }

        // Geographic coordinates
        String location = properties.getProperty(KEY_LOCATION);
        if (location != null && !setLocation(location)) {
            logger.severe(String.format("\"location\" value is invalid, using %s. Please, set a valid geographic coordinate", getGeographicCoordinates()));
        }
        debugLog(String.format("Using geographic coordinates: %s", getGeographicCoordinates()));

        // UTC offset
        String offset = properties.getProperty(KEY_UTC_OFFSET);
        if (offset != null && !setUtcOffset(offset)) {
            logger.log(Level.SEVERE, String.format(Locale.ENGLISH, "\"utc_offset\" value is invalid, using %s. Please, use \"auto\" or a number of hours between %.1f and %.1f.", getUtcOffset(), UTC_OFFSET_MIN_VALUE, UTC_OFFSET_MAX_VALUE));
        }
        debugLog(String.format(Locale.ENGLISH, "Using UTC offset %s (%+.2f hours)", getUtcOffset(), getUtcOffsetHours()));

        // Calculation method
        String method = properties.getProperty(KEY_CALCULATION_METHOD);
        if (method != null && !setCalculationMethod(method)) {
            logger.severe(String.format("\"calculation_method\" value \"%s\" is unknown, using \"%s\". Please, use one of mwl, isna, egypt, makkah or karachi.", method, getCalculationMethod().getKey()));
        }

        // Asr convention
        String asr = properties.getProperty(KEY_ASR_CONVENTION);
        if (asr != null && !setAsrConvention(asr)) {
            logger.severe(String.format("\"asr_convention\" value \"%s\" is unknown, using \"%s\". Please, use shafii or hanafi.", asr, getAsrConvention().getKey()));
        }
        debugLog(String.format("Using %s", getPrayerTimeCalculator()));

        // Hijri adjustment. Anything that is not an integer counts as zero.
        String adjustment = properties.getProperty(KEY_HIJRI_ADJUSTMENT);
        if (adjustment != null) {
            hijriAdjustment.set(adjustment);
        }
        debugLog(String.format("Hijri adjustment set to %s days", hijriAdjustment));

        // Time adjustment
        String timeAdj = properties.getProperty(KEY_TIME_ADJUSTMENT);
        if (timeAdj != null && !setTimeAdjustment(timeAdj)) {
            logger.severe(String.format("\"time_adjustment\" value is invalid, using %s. Please, use the format +MM:SS or -MM:SS.", getTimeAdjustment()));
        }
        debugLog(String.format("Time adjustment set to %s", getTimeAdjustment()));
    }

    String getLocation() {
        return this.location;
    }

    public GeographicCoordinate getGeographicCoordinates() {
        return this.geographicCoordinates;
    }

    public boolean setLocation(String newLocation) {
        if (isValidLocation(newLocation)) {
            this.location = newLocation;
            this.geographicCoordinates = parseLocationOption(newLocation);
            return true;
        } else {
            return false;
        }
    }

    private GeographicCoordinate parseLocationOption(String location) {
        // Try parse as decimal degrees
        Matcher decimalMatcher = REGEX_DECIMAL_DEGREES.matcher(location.trim());
        if (decimalMatcher.matches()) {
            try {
                double latitude = Double.parseDouble(decimalMatcher.group("latitude"));
                double longitude = Double.parseDouble(decimalMatcher.group("longitude"));
                return GeographicCoordinate.fromDecimalDegrees(latitude, longitude);
            } catch (NumberFormatException ignored) {
                // Not decimal degrees, try sexagesimal below
            }
        }

        // Try parse as sexagesimal degrees
        Matcher sexagesimalMatcher = REGEX_SEXAGESIMAL_DEGREES.matcher(location.trim());
        if (sexagesimalMatcher.matches()) {
            try {
                double[] lat = parseSexagesimal(sexagesimalMatcher, "Lat", "S");
                double[] lon = parseSexagesimal(sexagesimalMatcher, "Lon", "W");
                return GeographicCoordinate.fromSexagesimalDegrees(lat[0], lat[1], lat[2], lon[0], lon[1], lon[2]);
            } catch (NumberFormatException ignored) {
                // Unparsable, handled as an invalid location by the caller
            }
        }

        return null;
    }

    // Degrees, arc minutes and arc seconds of one axis, all negative for the given negative direction
    private static double[] parseSexagesimal(Matcher matcher, String axis, String negativeDirection) {
        double degrees = Double.parseDouble(matcher.group(axis + "Deg"));
        double arcMin = 0.0;
        double arcSec = 0.0;

        String arcMinGroup = matcher.group(axis + "ArcMin");
        if (arcMinGroup != null) {
            arcMin = Double.parseDouble(arcMinGroup);
        }

        String arcSecGroup = matcher.group(axis + "ArcSec");
        if (arcSecGroup != null) {
            arcSec = Double.parseDouble(arcSecGroup);
        }

        if (matcher.group(axis + "Direction").equals(negativeDirection)) {
            degrees *= -1;
            arcMin *= -1;
            arcSec *= -1;
        }

        return new double[] {degrees, arcMin, arcSec};
    }

    private boolean isValidLocation(String location) {
        if (location == null) return false;
        GeographicCoordinate coordinates = parseLocationOption(location);
        return coordinates != null && coordinates.isValid();
    }

    public String getUtcOffset() {
        return utcOffset;
    }

    /**
     * @return the configured offset, or the one estimated from the longitude when set to {@code auto}
     */
    public double getUtcOffsetHours() {
        if (utcOffset.equals(UTC_OFFSET_AUTO)) {
            return geographicCoordinates.estimatedUtcOffset();
        }
        return Double.parseDouble(utcOffset);
    }

    public boolean setUtcOffset(String newUtcOffset) {
        if (newUtcOffset == null) return false;
        String value = newUtcOffset.trim().toLowerCase(Locale.ROOT);
        if (value.equals(UTC_OFFSET_AUTO)) {
            this.utcOffset = UTC_OFFSET_AUTO;
            return true;
        }

        try {
            double hours = Double.parseDouble(value);
            if (Double.isNaN(hours) || hours < UTC_OFFSET_MIN_VALUE || hours > UTC_OFFSET_MAX_VALUE) {
                return false;
            }
            this.utcOffset = value;
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public CalculationMethod getCalculationMethod() {
        return calculationMethod;
    }

    public boolean setCalculationMethod(String key) {
        var method = CalculationMethod.fromKey(key);
        method.ifPresent(m -> this.calculationMethod = m);
        return method.isPresent();
    }

    public AsrConvention getAsrConvention() {
        return asrConvention;
    }

    public boolean setAsrConvention(String key) {
        var convention = AsrConvention.fromKey(key);
        convention.ifPresent(c -> this.asrConvention = c);
        return convention.isPresent();
    }

    public PrayerTimeCalculator getPrayerTimeCalculator() {
        return new PrayerTimeCalculator(calculationMethod, asrConvention);
    }

    public HijriAdjustment getHijriAdjustment() {
        return hijriAdjustment;
    }

    public HijriCalendar getHijriCalendar() {
        return hijriAdjustment.calendar();
    }

    public TimeAdjustment getTimeAdjustment() {
        return timeAdjustment;
    }

    public boolean setTimeAdjustment(String value) {
        var adjustment = TimeAdjustment.parse(value);
        adjustment.ifPresent(a -> this.timeAdjustment = a);
        return adjustment.isPresent();
    }

    public boolean getDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean mode) {
        this.debugMode = mode;
    }

    void debugLog(String message) {
        if (getDebugMode()) {
            logger.info(String.format("DEBUG: %s", message));
        }
    }
}
