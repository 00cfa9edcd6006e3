package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the supplied credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5517265470391806113L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
