package com.jobflow.broker;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;
import java.util.TreeSet;

import org.quartz.CronExpression;

/**
 * A standard 5-field cron pattern ({@code minute hour day-of-month month day-of-week}) evaluated
 * in a timezone.
 *
 * <p>Evaluation is delegated to Quartz's {@link CronExpression} after translating the pattern to
 * Quartz syntax: a {@code 0} seconds field is prepended, the unrestricted day field becomes
 * {@code ?}, and day-of-week numbers move from {@code 0-7} (Sunday is 0 and 7) to Quartz's
 * {@code 1-7} (Sunday is 1). Patterns restricting both day-of-month and day-of-week are rejected,
 * since Quartz cannot express their union.</p>
 *
 * <pre>{@code
 * CronSchedule daily = CronSchedule.parse("30 2 * * *", "UTC");
 * Instant next = daily.nextAfter(Instant.now());
 * }</pre>
 */
public final class CronSchedule {

    private final String pattern;
    private final String quartzExpression;
    private final TimeZone timeZone;

    private CronSchedule(String pattern, String quartzExpression, TimeZone timeZone) {
        this.pattern = pattern;
        this.quartzExpression = quartzExpression;
        this.timeZone = timeZone;
    }

    /**
     * @param pattern 5-field cron pattern
     * @param timezone IANA zone id, e.g. {@code UTC} or {@code Europe/Stockholm}
     * @throws IllegalArgumentException if the pattern or the timezone is invalid
     */
    public static CronSchedule parse(String pattern, String timezone) {
        if (pattern == null) {
            throw new IllegalArgumentException("Cron pattern must not be null");
        }
        TimeZone zone;
        try {
            zone = TimeZone.getTimeZone(ZoneId.of(timezone != null ? timezone : RepeatOptions.DEFAULT_TIMEZONE));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }

        String quartz = toQuartz(pattern);
        try {
            CronExpression.validateExpression(quartz);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron pattern '" + pattern + "': " + e.getMessage(), e);
        }
        return new CronSchedule(pattern, quartz, zone);
    }

    public String getPattern() {
        return pattern;
    }

    public String getQuartzExpression() {
        return quartzExpression;
    }

    /**
     * First fire time strictly after {@code after}, or null if the pattern never fires again.
     */
    public Instant nextAfter(Instant after) {
        CronExpression expression;
        try {
            expression = new CronExpression(quartzExpression);
        } catch (ParseException e) {
            throw new IllegalStateException("Cron expression became invalid: " + quartzExpression, e);
        }
        expression.setTimeZone(timeZone);
        Date next = expression.getNextValidTimeAfter(Date.from(after));
        return next != null ? next.toInstant() : null;
    }

    static String toQuartz(String pattern) {
        String[] fields = pattern.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Cron pattern must have 5 fields (minute hour day month weekday): '"
                    + pattern + "'");
        }
        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        boolean anyDayOfMonth = dayOfMonth.equals("*") || dayOfMonth.equals("?");
        boolean anyDayOfWeek = dayOfWeek.equals("*") || dayOfWeek.equals("?");
        if (!anyDayOfMonth && !anyDayOfWeek) {
            throw new IllegalArgumentException("Cron pattern restricts both day-of-month and day-of-week: '"
                    + pattern + "'");
        }

        if (anyDayOfWeek) {
            dayOfWeek = "?";
            dayOfMonth = stepFromOne(dayOfMonth.equals("?") ? "*" : dayOfMonth);
        } else {
            dayOfMonth = "?";
            dayOfWeek = translateDayOfWeek(dayOfWeek);
        }
        return "0 " + minute + " " + hour + " " + dayOfMonth + " " + stepFromOne(month) + " " + dayOfWeek;
    }

    // "*/n" in 1-based fields
    private static String stepFromOne(String field) {
        return field.startsWith("*/") ? "1" + field.substring(1) : field;
    }

    /**
     * Expand numeric day-of-week items into an explicit Quartz list. Items using day names are
     * kept, Quartz understands them.
     */
    private static String translateDayOfWeek(String field) {
        if (!field.matches("[0-9*,/\\-]+")) {
            return field;
        }
        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",")) {
            int step = 1;
            String range = item;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = parseDay(item.substring(slash + 1), field);
                range = item.substring(0, slash);
                if (step < 1) {
                    throw new IllegalArgumentException("Invalid day-of-week step: " + field);
                }
            }

            int from;
            int to;
            if (range.equals("*")) {
                from = 0;
                to = 6;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                from = parseDay(bounds[0], field);
                to = parseDay(bounds[1], field);
            } else {
                from = parseDay(range, field);
                to = slash >= 0 ? 6 : from;
            }
            if (from > to) {
                throw new IllegalArgumentException("Invalid day-of-week range: " + field);
            }
            for (int day = from; day <= to; day += step) {
                days.add((day % 7) + 1);
            }
        }

        StringBuilder quartz = new StringBuilder();
        for (Integer day : days) {
            if (quartz.length() > 0) {
                quartz.append(',');
            }
            quartz.append(day);
        }
        return quartz.toString();
    }

    private static int parseDay(String value, String field) {
        try {
            int day = Integer.parseInt(value);
            if (day < 0 || day > 7) {
                throw new IllegalArgumentException("Day-of-week out of range (0-7): " + field);
            }
            return day;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid day-of-week: " + field, e);
        }
    }

    @Override
    public String toString() {
        return "CronSchedule{'" + pattern + "' tz=" + timeZone.getID() + "}";
    }
}
