package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The request conflicts with the current state of the resource (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1208864401527358822L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
