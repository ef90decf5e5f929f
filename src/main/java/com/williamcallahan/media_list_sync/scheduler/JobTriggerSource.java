package com.williamcallahan.media_list_sync.scheduler;

/**
 * Turns a schedule expression into recurring firings. The scheduler core only depends on this
 * seam, so tests can drive firings by hand instead of waiting on a clock.
 */
public interface JobTriggerSource {

    /**
     * Fails with {@code ConfigurationException} when {@code schedule} is not a valid expression.
     */
    void validate(String schedule);

    /**
     * Binds {@code firing} to {@code schedule} and returns the trigger already started.
     */
    ScheduledTrigger bind(String jobName, String schedule, Runnable firing);
}
