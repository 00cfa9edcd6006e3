package com.eyelevel.docsummarizer.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for caller-visible errors that carry an HTTP status code. Subclasses are raised both by
 * the REST layer and by the outbound API client when a remote summarization service answers with an
 * error status.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -1872451009361424786L;
    private final int statusCode;

    /**
     * @param message    A descriptive message about the error.
     * @param statusCode The HTTP status code associated with the error.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
