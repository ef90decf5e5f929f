/**
 * Entry point for the media list synchronization service
 *
 * @author William Callahan
 *
 * Features:
 * - Runs recurring sync jobs on cron schedules
 * - Keeps OAuth credentials for list providers encrypted and refreshed
 * - Spaces and retries outbound calls to metadata APIs
 */

package com.williamcallahan.media_list_sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaListSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaListSyncApplication.class, args);
    }
}
