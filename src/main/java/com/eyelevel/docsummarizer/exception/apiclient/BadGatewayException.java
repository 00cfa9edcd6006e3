package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * An upstream service returned an invalid response (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2951887331846320716L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
