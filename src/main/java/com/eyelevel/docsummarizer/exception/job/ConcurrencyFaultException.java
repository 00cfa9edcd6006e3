package com.eyelevel.docsummarizer.exception.job;

import com.eyelevel.docsummarizer.exception.apiclient.InternalServerException;

import java.io.Serial;

/**
 * Signals a broken store invariant, such as a mutation that rewrites a job's identity. Seeing one
 * means a bug, not a caller error.
 */
public class ConcurrencyFaultException extends InternalServerException {
    @Serial
    private static final long serialVersionUID = -5647013387090186012L;

    public ConcurrencyFaultException(String message) {
        super(message);
    }
}
