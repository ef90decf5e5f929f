package com.williamcallahan.media_list_sync.scheduler;

/**
 * What caused a job invocation.
 */
public enum RunTrigger {
    /** Cron firing delivered by the trigger source */
    CRON,
    /** One-off run dispatched by {@link JobScheduler#start()} for {@code runOnStart} jobs */
    STARTUP,
    /** Explicit {@link JobScheduler#runJob(String)} call */
    MANUAL
}
