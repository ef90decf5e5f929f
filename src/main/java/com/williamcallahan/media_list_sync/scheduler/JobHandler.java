package com.williamcallahan.media_list_sync.scheduler;

import reactor.core.publisher.Mono;

/**
 * Asynchronous unit of scheduled work. The returned Mono's value becomes the result of
 * {@link JobScheduler#runJob(String)}; an error signal marks the run as failed.
 */
@FunctionalInterface
public interface JobHandler {

    Mono<?> execute(JobContext context);
}
