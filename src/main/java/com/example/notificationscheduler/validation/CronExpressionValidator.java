package com.example.notificationscheduler.validation;

import com.example.notificationscheduler.exception.InvalidCronJobException;
import com.example.notificationscheduler.service.scheduler.CronSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Checks five-field cron expressions before they reach the scheduler.
 * <p>
 * Each field accepts {@code *}, a number, {@code *}{@code /step}, a range {@code a-b}
 * or a comma separated list of numbers and ranges, within the field's bounds.
 */
@Slf4j
@Component
public class CronExpressionValidator {

    public static final String PARTS_MESSAGE = "Cron expression must have exactly 5 parts (minute hour day month weekday)";
    public static final String FORMAT_MESSAGE = "Invalid cron expression format";

    private static final Pattern NUMBER = Pattern.compile("\\d{1,2}");
    private static final Pattern STEP = Pattern.compile("\\*/(\\d{1,2})");
    private static final Pattern RANGE = Pattern.compile("(\\d{1,2})-(\\d{1,2})");

    private static final int[][] BOUNDS = {
            {0, 59}, // minute
            {0, 23}, // hour
            {1, 31}, // day of month
            {1, 12}, // month
            {0, 6}   // day of week
    };

    /**
     * @throws InvalidCronJobException when the expression is malformed
     */
    public void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronJobException(PARTS_MESSAGE);
        }
        var fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidCronJobException(PARTS_MESSAGE);
        }
        for (int i = 0; i < fields.length; i++) {
            if (!isValidField(fields[i], BOUNDS[i][0], BOUNDS[i][1])) {
                log.debug("Cron field {} '{}' rejected in '{}'", i, fields[i], expression);
                throw new InvalidCronJobException(FORMAT_MESSAGE);
            }
        }
        try {
            CronSchedule.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronJobException(FORMAT_MESSAGE, e);
        }
    }

    private boolean isValidField(String field, int min, int max) {
        if ("*".equals(field)) {
            return true;
        }
        var step = STEP.matcher(field);
        if (step.matches()) {
            var value = Integer.parseInt(step.group(1));
            return value >= 1 && value <= max;
        }
        for (var part : field.split(",", -1)) {
            if (!isValidAtom(part, min, max)) {
                return false;
            }
        }
        return true;
    }

    private boolean isValidAtom(String atom, int min, int max) {
        if (NUMBER.matcher(atom).matches()) {
            return inRange(Integer.parseInt(atom), min, max);
        }
        var range = RANGE.matcher(atom);
        if (range.matches()) {
            var from = Integer.parseInt(range.group(1));
            var to = Integer.parseInt(range.group(2));
            return inRange(from, min, max) && inRange(to, min, max) && from <= to;
        }
        return false;
    }

    private boolean inRange(int value, int min, int max) {
        return value >= min && value <= max;
    }
}
