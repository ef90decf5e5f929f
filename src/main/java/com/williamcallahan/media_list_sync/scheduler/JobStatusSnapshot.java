package com.williamcallahan.media_list_sync.scheduler;

import java.time.Instant;

/**
 * Point-in-time view of a registered job for status reporting.
 *
 * @param lastRun completion time of the last successful run, null if never succeeded
 * @param lastError message of the most recent failure, cleared by the next success
 * @param runCount number of successful runs
 * @param nextRun next fire time of the live trigger, null when not scheduled
 */
public record JobStatusSnapshot(String name,
                                String schedule,
                                boolean enabled,
                                boolean running,
                                Instant lastRun,
                                String lastError,
                                long runCount,
                                Instant nextRun) {
}
