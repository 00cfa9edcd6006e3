package com.eyelevel.docsummarizer.exception;

import java.io.Serial;

/**
 * Thrown by a summarization backend that cannot produce a summary, including after its retries are exhausted.
 */
public class SummarizationException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -7390815620951327164L;

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
