package com.example.notificationscheduler.service.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Parsed five-field cron schedule (minute hour day month weekday), always evaluated in UTC.
 * <p>
 * A schedule is one-time when it pins day-of-month together with month or
 * day-of-week. A one-time schedule with pinned day and month targets a single
 * instant in the current UTC year; once that instant has passed the schedule is expired.
 */
public final class CronSchedule {

    private static final String WILDCARD = "*";

    private final String expression;
    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String month;
    private final String dayOfWeek;
    private final CronExpression cronExpression;

    private CronSchedule(String expression, String[] fields) {
        this.expression = expression;
        this.minute = fields[0];
        this.hour = fields[1];
        this.dayOfMonth = fields[2];
        this.month = fields[3];
        this.dayOfWeek = fields[4];
        this.cronExpression = CronExpression.parse(toSpringExpression());
    }

    /**
     * @throws IllegalArgumentException if the expression does not have five fields or Spring cannot parse it
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        var trimmed = expression.trim();
        var fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Cron expression must have exactly 5 parts (minute hour day month weekday)");
        }
        return new CronSchedule(trimmed, fields);
    }

    public String getExpression() {
        return expression;
    }

    public boolean isOneTime() {
        var dayPinned = !WILDCARD.equals(dayOfMonth);
        return (dayPinned && !WILDCARD.equals(month)) || (dayPinned && !WILDCARD.equals(dayOfWeek));
    }

    /**
     * Spring cron expressions carry a leading seconds field
     */
    public String toSpringExpression() {
        return "0 " + minute + " " + hour + " " + dayOfMonth + " " + month + " " + dayOfWeek;
    }

    /**
     * The single instant a pinned day/month schedule targets, in the UTC year of {@code now}.
     * Empty when any of minute, hour, day or month is not a plain number or the date does not exist.
     */
    public Optional<Instant> targetInstant(Instant now) {
        if (WILDCARD.equals(dayOfMonth) || WILDCARD.equals(month)) {
            return Optional.empty();
        }
        try {
            var year = LocalDateTime.ofInstant(now, ZoneOffset.UTC).getYear();
            var target = LocalDateTime.of(year,
                    Integer.parseInt(month),
                    Integer.parseInt(dayOfMonth),
                    Integer.parseInt(hour),
                    Integer.parseInt(minute));
            return Optional.of(target.toInstant(ZoneOffset.UTC));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    public boolean isExpired(Instant now) {
        return isOneTime() && targetInstant(now).map(target -> target.isBefore(now)).orElse(false);
    }

    /**
     * Next fire strictly after {@code after}, in UTC. Empty when the schedule never fires again.
     */
    public Optional<Instant> nextRun(Instant after) {
        var next = cronExpression.next(LocalDateTime.ofInstant(after, ZoneOffset.UTC));
        return Optional.ofNullable(next).map(time -> time.toInstant(ZoneOffset.UTC));
    }

    @Override
    public String toString() {
        return expression;
    }
}
