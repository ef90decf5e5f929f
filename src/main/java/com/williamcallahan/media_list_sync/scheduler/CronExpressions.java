package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Helpers for standard 5-field cron expressions (minute, hour, day-of-month, month, day-of-week).
 * Spring's parser expects a leading seconds field, which is pinned to 0.
 */
public final class CronExpressions {

    private static final int STANDARD_FIELD_COUNT = 5;

    private CronExpressions() {
    }

    /**
     * Validates a 5-field expression and returns Spring's 6-field equivalent.
     */
    public static String toSpringExpression(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new ConfigurationException("Cron expression is required");
        }
        String[] fields = schedule.trim().split("\\s+");
        if (fields.length != STANDARD_FIELD_COUNT) {
            throw new ConfigurationException("Cron expression '" + schedule
                    + "' must have 5 fields (minute hour day-of-month month day-of-week)");
        }
        String springExpression = "0 " + String.join(" ", fields);
        try {
            CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron expression '" + schedule + "': " + e.getMessage(), e);
        }
        return springExpression;
    }

    public static Optional<Instant> nextExecution(String schedule, Instant after, ZoneId zone) {
        CronExpression expression = CronExpression.parse(toSpringExpression(schedule));
        ZonedDateTime next = expression.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }
}
