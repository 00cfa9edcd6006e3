package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The credentials are valid but do not grant access to the resource (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -8180329736630271104L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
