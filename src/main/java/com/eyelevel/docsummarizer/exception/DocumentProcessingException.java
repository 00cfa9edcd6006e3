package com.eyelevel.docsummarizer.exception;

import java.io.Serial;

/**
 * Base exception for unexpected errors inside document handling that are not tied to a single job stage.
 */
public class DocumentProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3325866130187467115L;

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
