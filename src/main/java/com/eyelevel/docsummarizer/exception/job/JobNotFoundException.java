package com.eyelevel.docsummarizer.exception.job;

import com.eyelevel.docsummarizer.exception.apiclient.NotFoundException;

import java.io.Serial;

public class JobNotFoundException extends NotFoundException {
    @Serial
    private static final long serialVersionUID = 4470036281947126505L;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
