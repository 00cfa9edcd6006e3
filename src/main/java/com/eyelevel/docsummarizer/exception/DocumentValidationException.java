package com.eyelevel.docsummarizer.exception;

import com.eyelevel.docsummarizer.exception.apiclient.BadRequestException;

import java.io.Serial;

/**
 * Raised when an uploaded document or its options are rejected before any job is created.
 */
public class DocumentValidationException extends BadRequestException {
    @Serial
    private static final long serialVersionUID = 1520447317280062245L;

    public DocumentValidationException(String message) {
        super(message);
    }
}
