package io.cronwarden.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Five-field cron expression with minute resolution, evaluated by Quartz {@link CronExpression}.
 *
 * <p>Fields: minute (0-59), hour (0-23), day-of-month (1-31), month (1-12 or JAN-DEC),
 * day-of-week (0-7 or SUN-SAT, where both 0 and 7 mean Sunday). Each field accepts
 * {@code *}, single values, comma lists, ranges {@code a-b} and steps {@code *}{@code /n},
 * {@code a-b/n} or {@code a/n}.
 *
 * <p>At most one of day-of-month and day-of-week may be restricted.
 */
public final class ScheduleExpression {

    private final String source;
    private final String quartzExpression;
    // CronExpression carries its own time zone, so keep one per zone asked for.
    private final Map<ZoneId, CronExpression> byZone = new ConcurrentHashMap<>();

    private ScheduleExpression(String source, String quartzExpression) {
        this.source = source;
        this.quartzExpression = quartzExpression;
    }

    /**
     * Parse a five-field expression.
     *
     * @throws IllegalArgumentException if the expression is malformed or a value is out of range
     */
    public static ScheduleExpression parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Schedule expression must not be empty");
        }
        String[] fields = s.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Schedule expression must have 5 fields: " + expression);
        }
        String source = String.join(" ", fields);
        checkField(fields[0], false, "minute", source);
        checkField(fields[1], false, "hour", source);
        checkField(fields[2], false, "day-of-month", source);
        checkField(fields[3], true, "month", source);
        checkField(fields[4], true, "day-of-week", source);

        String quartz = toQuartzCron(fields[0], fields[1], fields[2], fields[3], fields[4], source);
        try {
            new CronExpression(quartz);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid schedule expression: " + source + " (" + e.getMessage() + ")", e);
        }
        return new ScheduleExpression(source, quartz);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean matches(ZonedDateTime time) {
        Objects.requireNonNull(time, "time must not be null");
        ZonedDateTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        return cron(time.getZone()).isSatisfiedBy(Date.from(minute.toInstant()));
    }

    public boolean matches(Instant instant, ZoneId zone) {
        return matches(ZonedDateTime.ofInstant(instant, zone));
    }

    /**
     * First matching minute strictly after {@code after}, or {@code null} if the expression
     * can never match (e.g. February 31st).
     */
    public ZonedDateTime nextMatchAfter(ZonedDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        Date next = cron(after.getZone()).getNextValidTimeAfter(Date.from(after.toInstant()));
        return next == null ? null : ZonedDateTime.ofInstant(next.toInstant(), after.getZone());
    }

    private CronExpression cron(ZoneId zone) {
        return byZone.computeIfAbsent(zone, z -> {
            try {
                CronExpression exp = new CronExpression(quartzExpression);
                exp.setTimeZone(TimeZone.getTimeZone(z));
                return exp;
            } catch (ParseException e) {
                throw new IllegalStateException("Schedule expression no longer parses: " + source, e);
            }
        });
    }

    /**
     * Quartz wants a seconds field, numbers day-of-week 1-7 from Sunday and needs {@code ?}
     * in whichever day field is unrestricted.
     */
    private static String toQuartzCron(String min, String hour, String dayOfMonth, String month, String dayOfWeek,
                                       String source) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);

        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            throw new IllegalArgumentException(
                    "Day-of-month and day-of-week cannot both be restricted in: " + source);
        }
        return String.join(" ", "0", min, hour, dom, month, dow);
    }

    private static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field)) {
            return field;
        }
        String[] tokens = field.split(",");
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            String step = "";
            int slash = token.indexOf('/');
            if (slash >= 0) {
                step = token.substring(slash);
                token = token.substring(0, slash);
            }
            int dash = token.indexOf('-');
            if (dash > 0) {
                String lo = token.substring(0, dash);
                String hi = token.substring(dash + 1);
                token = "0".equals(lo) && "7".equals(hi)
                        ? "1-7"
                        : shiftDay(lo) + "-" + shiftDay(hi);
            } else if (!"*".equals(token)) {
                token = shiftDay(token);
            }
            tokens[i] = token + step;
        }
        return String.join(",", tokens);
    }

    private static String shiftDay(String value) {
        if (value.isEmpty() || !Character.isDigit(value.charAt(0))) {
            return value;
        }
        int day = Integer.parseInt(value);
        if (day > 7) {
            // out of range on purpose so Quartz rejects it
            return value;
        }
        return String.valueOf(day == 7 ? 1 : day + 1);
    }

    private static void checkField(String field, boolean namesAllowed, String label, String source) {
        String allowed = namesAllowed ? "[A-Za-z0-9*/,-]+" : "[0-9*/,-]+";
        if (!field.matches(allowed)
                || field.startsWith(",") || field.endsWith(",") || field.contains(",,")
                || field.matches(".*/0*(,.*|$)")
                || field.matches(".*/[^0-9].*|.*/$")) {
            throw new IllegalArgumentException("Invalid " + label + " field '" + field + "' in schedule expression: " + source);
        }
    }

    public String source() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleExpression other)) return false;
        return source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
