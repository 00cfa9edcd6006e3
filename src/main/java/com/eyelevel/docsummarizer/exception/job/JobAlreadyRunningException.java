package com.eyelevel.docsummarizer.exception.job;

import com.eyelevel.docsummarizer.exception.apiclient.ConflictException;

import java.io.Serial;

/**
 * A start was requested for a job that already has an active run.
 */
public class JobAlreadyRunningException extends ConflictException {
    @Serial
    private static final long serialVersionUID = -2906181853357707734L;

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
    }
}
