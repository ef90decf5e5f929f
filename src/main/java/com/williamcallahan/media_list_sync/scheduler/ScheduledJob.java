package com.williamcallahan.media_list_sync.scheduler;

/**
 * A job contributed as a Spring bean. {@link JobRegistrar} registers every bean of this type
 * when the application is ready, applying any {@code app.jobs.definitions.<name>} overrides.
 */
public interface ScheduledJob extends JobHandler {

    String name();

    /** 5-field cron expression used when no override is configured */
    String defaultSchedule();

    default JobOptions defaultOptions() {
        return JobOptions.DEFAULTS;
    }
}
