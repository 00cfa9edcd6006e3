package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The service cannot accept the request right now (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4763360952134458021L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
