package com.eyelevel.docsummarizer.exception.job;

import com.eyelevel.docsummarizer.exception.apiclient.ConflictException;

import java.io.Serial;

/**
 * The requested change is not allowed from the job's current status, for example writing to a
 * terminal job, starting a finished job or deleting a running one.
 */
public class JobStateConflictException extends ConflictException {
    @Serial
    private static final long serialVersionUID = 8534912745003366210L;

    public JobStateConflictException(String message) {
        super(message);
    }
}
