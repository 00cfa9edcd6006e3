package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * An unexpected error occurred while serving the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6095120736470317150L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
