package com.williamcallahan.media_list_sync.scheduler;

/**
 * Registration options for a job.
 *
 * @param runOnStart also run once, asynchronously, when the scheduler starts
 * @param enabled bind a trigger for this job when the scheduler starts
 */
public record JobOptions(boolean runOnStart, boolean enabled) {

    public static final JobOptions DEFAULTS = new JobOptions(false, true);

    public JobOptions withRunOnStart(boolean value) {
        return new JobOptions(value, enabled);
    }

    public JobOptions withEnabled(boolean value) {
        return new JobOptions(runOnStart, value);
    }
}
