package io.cronwarden.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses interval schedules into minute-resolution cron expressions.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Numeric seconds: "300"</li>
 *   <li>Compact: "15m", "2h", "1d"</li>
 *   <li>Human-readable: "5 minutes", "1 hour 30 minutes"</li>
 * </ul>
 * <p>
 * The dispatcher ticks once per minute, so intervals shorter than a minute run every minute
 * and intervals are truncated to whole minutes.
 */
public final class IntervalParser {
    private static final Logger log = LoggerFactory.getLogger(IntervalParser.class);

    private IntervalParser() {
    }

    /**
     * Convert an interval into an equivalent five-field cron expression.
     *
     * @throws IllegalArgumentException if the interval is malformed or cannot be expressed
     *                                  as an evenly dividing cron step
     */
    public static String toCron(String interval) {
        Duration d = parseDuration(interval);
        long minutes = d.toMinutes();

        if (minutes < 1) {
            log.warn("Interval {} is less than 1 minute, using 1 minute", interval);
            return "* * * * *";
        }
        if (minutes == 1) {
            return "* * * * *";
        }
        if (minutes < 60) {
            if (60 % minutes != 0) {
                throw new IllegalArgumentException("Interval does not divide an hour evenly: " + interval);
            }
            return "*/" + minutes + " * * * *";
        }
        if (minutes % 60 == 0 && minutes / 60 < 24) {
            long hours = minutes / 60;
            if (24 % hours != 0) {
                throw new IllegalArgumentException("Interval does not divide a day evenly: " + interval);
            }
            return hours == 1 ? "0 * * * *" : "0 */" + hours + " * * *";
        }
        if (minutes == 24 * 60) {
            return "0 0 * * *";
        }
        throw new IllegalArgumentException("Interval cannot be expressed as a schedule: " + interval);
    }

    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "interval must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval must not be empty");
        }

        if (s.matches("^\\d+$")) {
            return positive(Duration.ofSeconds(parseLong(s, input)), input);
        }

        if (s.matches("^\\d+\\s*[smhd]$")) {
            long n = parseLong(s.replaceAll("[^0-9]", ""), input);
            char unit = s.charAt(s.length() - 1);
            return positive(switch (unit) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            }, input);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '5 minutes': " + input);
        }

        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseLong(parts[i], input);
            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }
            total = total.plus(switch (unit) {
                case "day" -> Duration.ofDays(n);
                case "hour" -> Duration.ofHours(n);
                case "minute", "min" -> Duration.ofMinutes(n);
                case "second", "sec" -> Duration.ofSeconds(n);
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            });
        }
        return positive(total, input);
    }

    private static long parseLong(String digits, String input) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
