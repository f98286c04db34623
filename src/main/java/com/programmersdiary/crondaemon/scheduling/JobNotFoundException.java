package com.programmersdiary.crondaemon.scheduling;

public class JobNotFoundException extends RuntimeException {

    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job #" + jobId + " not found.");
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
