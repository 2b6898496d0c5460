package com.umitunal.cronlite.schedule;

import com.umitunal.cronlite.core.InvalidExpressionException;
import com.umitunal.cronlite.core.NoUpcomingOccurrenceException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed cron-style recurrence expression.
 *
 * <p>Accepts five fields (minute, hour, day-of-month, month, day-of-week) or six
 * with a leading seconds field. Each field takes {@code *}, single values,
 * ranges {@code a-b}, steps <code>*&#47;n</code>, {@code a/n}, {@code a-b/n} and
 * comma-separated lists. Months and weekdays may be given by their three-letter
 * English names; Sunday is both 0 and 7. When day-of-month and day-of-week are
 * both restricted, a day matches if either field matches.
 *
 * <p>The macros {@code @yearly}, {@code @annually}, {@code @monthly},
 * {@code @weekly}, {@code @daily}, {@code @midnight} and {@code @hourly} are
 * also recognized.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class CronExpression {

    /**
     * How far ahead {@link #nextFireTime(Instant)} searches before giving up.
     */
    public static final int SEARCH_HORIZON_YEARS = 5;

    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    private final String expression;
    private final ZoneId zone;
    private final CronField seconds;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private final CronField daysOfWeek;

    private CronExpression(String expression, ZoneId zone, CronField seconds, CronField minutes,
                           CronField hours, CronField daysOfMonth, CronField months, CronField daysOfWeek) {
        this.expression = expression;
        this.zone = zone;
        this.seconds = seconds;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }

    /**
     * Parse an expression evaluated in UTC.
     */
    public static CronExpression parse(String expression) {
        return parse(expression, ZoneOffset.UTC);
    }

    /**
     * Parse an expression evaluated in the given zone.
     *
     * @throws InvalidExpressionException if the expression is malformed
     */
    public static CronExpression parse(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException(String.valueOf(expression), "expression is empty");
        }

        String trimmed = expression.trim();
        String source = trimmed;
        if (trimmed.startsWith("@")) {
            source = MACROS.get(trimmed.toLowerCase(Locale.ROOT));
            if (source == null) {
                throw new InvalidExpressionException(expression, "unknown macro " + trimmed);
            }
        }

        String[] fields = source.split("\\s+");
        int offset;
        CronField seconds;
        if (fields.length == 5) {
            offset = 0;
            seconds = CronField.parse(CronField.Type.SECOND, "0", expression);
        } else if (fields.length == 6) {
            offset = 1;
            seconds = CronField.parse(CronField.Type.SECOND, fields[0], expression);
        } else {
            throw new InvalidExpressionException(expression,
                    "expected 5 or 6 fields but found " + fields.length);
        }

        return new CronExpression(trimmed, zone, seconds,
                CronField.parse(CronField.Type.MINUTE, fields[offset], expression),
                CronField.parse(CronField.Type.HOUR, fields[offset + 1], expression),
                CronField.parse(CronField.Type.DAY_OF_MONTH, fields[offset + 2], expression),
                CronField.parse(CronField.Type.MONTH, fields[offset + 3], expression),
                CronField.parse(CronField.Type.DAY_OF_WEEK, fields[offset + 4], expression));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidExpressionException e) {
            return false;
        }
    }

    /**
     * Earliest instant strictly after {@code after} that matches this expression.
     *
     * @throws NoUpcomingOccurrenceException if nothing matches within
     *         {@link #SEARCH_HORIZON_YEARS} years
     */
    public Instant nextFireTime(Instant after) {
        ZonedDateTime candidate = after.atZone(zone).truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        ZonedDateTime limit = candidate.plusYears(SEARCH_HORIZON_YEARS);

        while (!candidate.isAfter(limit)) {
            if (!months.matches(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }

            int hour = hours.nextOrSame(candidate.getHour());
            if (hour != candidate.getHour()) {
                candidate = hour < 0
                        ? candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1)
                        : candidate.truncatedTo(ChronoUnit.HOURS).plusHours(hour - candidate.getHour());
                continue;
            }

            int minute = minutes.nextOrSame(candidate.getMinute());
            if (minute != candidate.getMinute()) {
                candidate = minute < 0
                        ? candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1)
                        : candidate.truncatedTo(ChronoUnit.MINUTES).plusMinutes(minute - candidate.getMinute());
                continue;
            }

            int second = seconds.nextOrSame(candidate.getSecond());
            if (second != candidate.getSecond()) {
                candidate = second < 0
                        ? candidate.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1)
                        : candidate.plusSeconds(second - candidate.getSecond());
                continue;
            }

            return candidate.toInstant();
        }

        throw new NoUpcomingOccurrenceException(expression, after, SEARCH_HORIZON_YEARS);
    }

    /**
     * Checks whether the instant, truncated to seconds, matches every field.
     */
    public boolean matches(Instant instant) {
        ZonedDateTime time = instant.atZone(zone);
        return seconds.matches(time.getSecond())
                && minutes.matches(time.getMinute())
                && hours.matches(time.getHour())
                && months.matches(time.getMonthValue())
                && dayMatches(time);
    }

    private boolean dayMatches(ZonedDateTime time) {
        boolean dayOfMonth = daysOfMonth.matches(time.getDayOfMonth());
        boolean dayOfWeek = daysOfWeek.matches(time.getDayOfWeek().getValue() % 7);
        if (daysOfMonth.isRestricted() && daysOfWeek.isRestricted()) {
            return dayOfMonth || dayOfWeek;
        }
        return dayOfMonth && dayOfWeek;
    }

    public String getExpression() {
        return expression;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression)) return false;
        CronExpression that = (CronExpression) o;
        return expression.equals(that.expression) && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, zone);
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
