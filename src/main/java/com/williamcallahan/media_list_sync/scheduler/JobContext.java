package com.williamcallahan.media_list_sync.scheduler;

import java.time.Instant;

/**
 * Invocation details handed to a {@link JobHandler}.
 */
public record JobContext(String jobName, RunTrigger trigger, Instant firedAt) {
}
