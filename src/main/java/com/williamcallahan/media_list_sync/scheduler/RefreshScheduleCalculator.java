package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.ConfigurationException;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * Converts a refresh interval in hours plus a preferred {@code HH:MM} time of day into a
 * 5-field cron expression.
 */
public final class RefreshScheduleCalculator {

    public static final int MIN_INTERVAL_HOURS = 1;
    public static final int MAX_INTERVAL_HOURS = 8760;

    private static final int HOURS_PER_DAY = 24;
    private static final int HOURS_PER_WEEK = 168;

    private RefreshScheduleCalculator() {
    }

    /**
     * @param intervalHours refresh interval, 1..8760
     * @param refreshTime preferred time of day as {@code HH:MM}; null or blank means midnight
     */
    public static String toCron(int intervalHours, String refreshTime) {
        if (intervalHours < MIN_INTERVAL_HOURS || intervalHours > MAX_INTERVAL_HOURS) {
            throw new ConfigurationException("Refresh interval must be between " + MIN_INTERVAL_HOURS
                    + " and " + MAX_INTERVAL_HOURS + " hours, got " + intervalHours);
        }
        LocalTime time = parseTime(refreshTime);
        int minute = time.getMinute();
        int hour = time.getHour();

        if (intervalHours <= 1) {
            return minute + " * * * *";
        }
        if (intervalHours < HOURS_PER_DAY) {
            return minute + " */" + intervalHours + " * * *";
        }
        if (intervalHours == HOURS_PER_DAY) {
            return minute + " " + hour + " * * *";
        }
        if (intervalHours <= HOURS_PER_WEEK) {
            long days = Math.round(intervalHours / (double) HOURS_PER_DAY);
            return minute + " " + hour + " */" + days + " * *";
        }
        // Longer than a week: monthly on the 1st
        return minute + " " + hour + " 1 * *";
    }

    private static LocalTime parseTime(String refreshTime) {
        if (refreshTime == null || refreshTime.isBlank()) {
            return LocalTime.MIDNIGHT;
        }
        try {
            return LocalTime.parse(refreshTime.trim().length() == 4 ? "0" + refreshTime.trim() : refreshTime.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Refresh time must be HH:MM, got '" + refreshTime + "'", e);
        }
    }
}
