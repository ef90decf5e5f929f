/**
 * Configuration for graceful application shutdown handling
 *
 * @author William Callahan
 *
 * Features:
 * - Stops the job scheduler before beans are destroyed so no new firings start
 * - Waits a bounded time for in-flight job runs to finish on their own
 * - Drains the trigger thread pool last
 */

package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.scheduler.JobScheduler;
import com.williamcallahan.media_list_sync.scheduler.JobStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownConfig.class);

    private final AtomicBoolean shutdownInitiated = new AtomicBoolean(false);

    private final JobScheduler jobScheduler;
    private final ThreadPoolTaskScheduler jobTaskScheduler;
    private final ApplicationContext applicationContext;

    @Value("${app.jobs.shutdown-timeout-ms:30000}")
    private long shutdownTimeoutMs;

    public GracefulShutdownConfig(JobScheduler jobScheduler,
                                  @Qualifier("jobTaskScheduler") ThreadPoolTaskScheduler jobTaskScheduler,
                                  ApplicationContext applicationContext) {
        this.jobScheduler = jobScheduler;
        this.jobTaskScheduler = jobTaskScheduler;
        this.applicationContext = applicationContext;
    }

    public boolean isShuttingDown() {
        return shutdownInitiated.get();
    }

    /**
     * Handles the application shutdown event
     *
     * @param event Spring context closed event
     */
    @Override
    public void onApplicationEvent(@NonNull ContextClosedEvent event) {
        if (event.getApplicationContext() != applicationContext) {
            return;
        }
        if (!shutdownInitiated.compareAndSet(false, true)) {
            return;
        }
        logger.info("Application shutdown event received - initiating graceful shutdown");

        logger.info("Phase 1: Stopping job triggers");
        jobScheduler.stop();

        logger.info("Phase 2: Waiting for in-flight job runs");
        waitForRunningJobs();

        logger.info("Phase 3: Draining job trigger pool");
        jobTaskScheduler.shutdown();

        logger.info("Graceful shutdown completed");
    }

    void waitForRunningJobs() {
        long deadline = System.currentTimeMillis() + shutdownTimeoutMs;
        List<String> running = runningJobs();
        while (!running.isEmpty() && System.currentTimeMillis() < deadline) {
            logger.info("Still running: {}", running);
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for job runs", e);
                return;
            }
            running = runningJobs();
        }
        if (!running.isEmpty()) {
            logger.warn("Jobs {} did not complete within {}ms, proceeding with shutdown", running, shutdownTimeoutMs);
        }
    }

    private List<String> runningJobs() {
        return jobScheduler.getStatus().stream()
            .filter(JobStatusSnapshot::running)
            .map(JobStatusSnapshot::name)
            .toList();
    }
}
