package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is rate limiting this client (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7433107265617102987L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
