package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The request was rejected because its content was invalid (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2283911876113058431L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
