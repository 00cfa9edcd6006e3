package com.eyelevel.docsummarizer.exception.apiclient;

import java.io.Serial;

/**
 * An upstream service did not answer in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8802659331245509314L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
