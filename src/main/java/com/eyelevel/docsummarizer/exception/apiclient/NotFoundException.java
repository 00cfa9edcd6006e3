package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The requested resource does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3641972024119552861L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
