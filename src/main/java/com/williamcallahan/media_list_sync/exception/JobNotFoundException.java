package com.williamcallahan.media_list_sync.exception;

public class JobNotFoundException extends SyncException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.JOB_NOT_FOUND;
    }
}
