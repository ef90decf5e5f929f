/**
 * Background job configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.media_list_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app.jobs")
public class JobsProperties {

    /** Start the scheduler once jobs are registered */
    private boolean schedulerEnabled = true;

    /** Threads delivering cron firings */
    private int poolSize = 2;

    /** Zone cron expressions are evaluated in; blank means the system default */
    private String timeZone;

    /** Per-job overrides keyed by job name */
    private Map<String, Definition> definitions = new HashMap<>();

    public boolean isSchedulerEnabled() { return schedulerEnabled; }
    public void setSchedulerEnabled(boolean schedulerEnabled) { this.schedulerEnabled = schedulerEnabled; }

    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

    public String getTimeZone() { return timeZone; }
    public void setTimeZone(String timeZone) { this.timeZone = timeZone; }

    public Map<String, Definition> getDefinitions() { return definitions; }
    public void setDefinitions(Map<String, Definition> definitions) { this.definitions = definitions; }

    /**
     * Overrides for a single job. Unset fields keep the job's defaults. {@code schedule} wins over
     * {@code refreshIntervalHours} when both are set.
     */
    public static class Definition {
        private String schedule;
        private Integer refreshIntervalHours;
        private String refreshTime;
        private Boolean enabled;
        private Boolean runOnStart;

        public String getSchedule() { return schedule; }
        public void setSchedule(String schedule) { this.schedule = schedule; }

        public Integer getRefreshIntervalHours() { return refreshIntervalHours; }
        public void setRefreshIntervalHours(Integer refreshIntervalHours) { this.refreshIntervalHours = refreshIntervalHours; }

        public String getRefreshTime() { return refreshTime; }
        public void setRefreshTime(String refreshTime) { this.refreshTime = refreshTime; }

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }

        public Boolean getRunOnStart() { return runOnStart; }
        public void setRunOnStart(Boolean runOnStart) { this.runOnStart = runOnStart; }
    }
}
