package com.williamcallahan.media_list_sync.scheduler;

import java.time.Instant;
import java.util.Optional;

/**
 * Live handle to a recurring trigger bound by a {@link JobTriggerSource}.
 * Stopping never interrupts a firing that is already executing.
 */
public interface ScheduledTrigger {

    void start();

    void stop();

    boolean isActive();

    /**
     * Next time the trigger fires, empty when stopped.
     */
    Optional<Instant> nextFireTime();
}
