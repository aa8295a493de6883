package com.github.nikalon.hijritime;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command line front end.
 *
 * <pre>
 * hijri [yyyy-MM-dd]          Hijri date of a Gregorian date (default today)
 * gregorian yyyy-MM-dd        Gregorian date of a Hijri date
 * times [yyyy-MM-dd]          prayer times of a Gregorian date (default today)
 * next                        next prayer and time left
 * qibla                       direction of the Kaaba
 * config                      current configuration
 * </pre>
 */
public class HijriTime {
    static final String CONFIGURATION_FILE = "hijritime.properties";
    private static final String LOGGING_CONFIGURATION_FILE = "/logging.properties";
    private static final String USAGE = "Usage: hijritime <hijri|gregorian|times|next|qibla|config> [arguments]";
    private static final Pattern REGEX_HIJRI_DATE = Pattern.compile("(?<year>-?\\d+)-(?<month>\\d{1,2})-(?<day>\\d{1,2})");

    private final Configuration configuration;
    private final Clock systemClock;
    private final PrintStream out;

    // Parameters of the command line
    private final Map<String, ParameterParser> commandParameters;

    HijriTime(Configuration configuration, Clock systemClock, PrintStream out) {
        this.configuration = configuration;
        this.systemClock = systemClock;
        this.out = out;

        commandParameters = new LinkedHashMap<>();
        commandParameters.put("hijri", this::parseHijriCommand);
        commandParameters.put("gregorian", this::parseGregorianCommand);
        commandParameters.put("times", this::parseTimesCommand);
        commandParameters.put("next", args -> parseNextCommand());
        commandParameters.put("qibla", args -> parseQiblaCommand());
        commandParameters.put("config", args -> parseConfigCommand());
    }

    public static void main(String[] args) {
        loadLoggingConfiguration();
        Logger logger = Logger.getLogger(HijriTime.class.getName());

        var configuration = new Configuration(logger);
        try {
            configuration.load(loadProperties());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Could not read the configuration file, using default values", e);
        }

        boolean ok = new HijriTime(configuration, Clock.systemUTC(), System.out).run(args);
        if (!ok) System.exit(1);
    }

    private static void loadLoggingConfiguration() {
        try (InputStream in = HijriTime.class.getResourceAsStream(LOGGING_CONFIGURATION_FILE)) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not read logging configuration: " + e.getMessage());
        }
    }

    // The file in the working directory takes precedence over the bundled default
    static Properties loadProperties() throws IOException {
        return loadProperties(Paths.get(CONFIGURATION_FILE));
    }

    // Read as UTF-8, locations may contain the degree sign
    static Properties loadProperties(Path local) throws IOException {
        Properties properties = new Properties();
        if (Files.isRegularFile(local)) {
            try (Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        } else {
            try (InputStream in = HijriTime.class.getResourceAsStream("/" + CONFIGURATION_FILE)) {
                if (in != null) properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        return properties;
    }

    /**
     * @return {@code false} if the command was not understood or its arguments were invalid
     */
    boolean run(String[] args) {
        if (args.length == 0) {
            out.println(USAGE);
            return false;
        }

        var parameter = args[0];
        var parser = commandParameters.get(parameter);
        if (parser == null) {
            out.println(String.format("Unknown parameter \"%s\"", parameter));
            out.println(USAGE);
            return false;
        }
        return parser.parse(Arrays.asList(args).subList(1, args.length));
    }

    // Local date and time at the configured UTC offset
    private OffsetDateTime now() {
        int offsetSeconds = (int) Math.round(configuration.getUtcOffsetHours() * 3600);
        return OffsetDateTime.now(systemClock.withZone(ZoneOffset.ofTotalSeconds(offsetSeconds)));
    }

    private static double decimalHour(OffsetDateTime time) {
        return time.getHour() + time.getMinute() / 60.0 + time.getSecond() / 3600.0;
    }

    private LocalDate parseGregorianDateArgument(List<String> args) {
        if (args.isEmpty()) return now().toLocalDate();
        try {
            return LocalDate.parse(args.get(0));
        } catch (DateTimeException e) {
            out.println(String.format("Invalid date \"%s\". Please, enter a Gregorian date in the format yyyy-MM-dd", args.get(0)));
            return null;
        }
    }

    private boolean parseHijriCommand(List<String> args) {
        LocalDate date = parseGregorianDateArgument(args);
        if (date == null) return false;

        var calendar = configuration.getHijriCalendar();
        HijriDate hijri = calendar.gregorianToHijri(date);
        out.println(String.format("%s is %s (%s)", date, hijri, dayName(calendar.dayOfWeek(hijri))));
        return true;
    }

    private boolean parseGregorianCommand(List<String> args) {
        if (args.isEmpty()) {
            out.println("Missing date. Please, enter a Hijri date in the format yyyy-MM-dd");
            return false;
        }

        Matcher matcher = REGEX_HIJRI_DATE.matcher(args.get(0));
        HijriDate hijri = null;
        if (matcher.matches()) {
            try {
                hijri = new HijriDate(Integer.parseInt(matcher.group("year")),
                        Integer.parseInt(matcher.group("month")),
                        Integer.parseInt(matcher.group("day")));
            } catch (NumberFormatException ignored) {
                // Year out of range, reported below
            }
        }

        if (hijri == null || !hijri.isValid()) {
            out.println(String.format("Invalid date \"%s\". Please, enter a Hijri date in the format yyyy-MM-dd", args.get(0)));
            return false;
        }

        var calendar = configuration.getHijriCalendar();
        GregorianDate gregorian = calendar.hijriToGregorian(hijri);
        out.println(String.format("%s is %s (%s)", hijri, gregorian, dayName(calendar.dayOfWeek(hijri))));
        return true;
    }

    private boolean parseTimesCommand(List<String> args) {
        LocalDate date = parseGregorianDateArgument(args);
        if (date == null) return false;

        PrayerTimeSet times = todayTimes(date);
        out.println(String.format("Prayer times for %s at %s (UTC%s)", date, configuration.getGeographicCoordinates(), formatOffset()));
        times.asMap().forEach((prayer, time) ->
                out.println(String.format("%-9s %s  %s", prayer.getDisplayName(), time.to24HourString(), time.to12HourString())));

        String adjustment = configuration.getTimeAdjustment().isZero() ? "" : " | Adj: " + configuration.getTimeAdjustment();
        out.println(String.format("Method: %s, %s Asr%s", configuration.getCalculationMethod().getDisplayName(), configuration.getAsrConvention().getKey(), adjustment));
        return true;
    }

    private boolean parseNextCommand() {
        OffsetDateTime now = now();
        double currentHour = decimalHour(now);
        PrayerTimeSet times = todayTimes(now.toLocalDate());

        var next = times.nextPrayer(currentHour);
        if (next.isEmpty()) {
            out.println("No prayer time can be computed for this location today");
            return true;
        }

        out.println(String.format("Next: %s, in %s", next.get(), next.get().countdownFrom(currentHour)));
        return true;
    }

    private boolean parseQiblaCommand() {
        var coordinates = configuration.getGeographicCoordinates();
        out.println(String.format(Locale.ENGLISH, "Qibla direction from %s is %.2f° from true north", coordinates, Qibla.bearing(coordinates)));
        return true;
    }

    private boolean parseConfigCommand() {
        out.println(String.format("Location: %s", configuration.getGeographicCoordinates()));
        out.println(String.format("UTC offset: %s (UTC%s)", configuration.getUtcOffset(), formatOffset()));
        out.println(String.format("Calculation method: %s", configuration.getCalculationMethod().getKey()));
        out.println(String.format("Asr convention: %s", configuration.getAsrConvention().getKey()));
        out.println(String.format("Hijri adjustment: %s days", configuration.getHijriAdjustment()));
        out.println(String.format("Time adjustment: %s", configuration.getTimeAdjustment()));
        return true;
    }

    private PrayerTimeSet todayTimes(LocalDate date) {
        return configuration.getPrayerTimeCalculator()
                .calculate(date, configuration.getGeographicCoordinates(), configuration.getUtcOffsetHours())
                .shift(configuration.getTimeAdjustment());
    }

    private String formatOffset() {
        return String.format(Locale.ENGLISH, "%+.2f", configuration.getUtcOffsetHours());
    }

    // 0 = Sunday
    private static String dayName(int dayOfWeek) {
        return DayOfWeek.of(dayOfWeek == 0 ? 7 : dayOfWeek).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private interface ParameterParser {
        boolean parse(List<String> arguments);
    }
}
