package com.eyelevel.docsummarizer.exception;

import java.io.Serial;

/**
 * Reports that a pipeline stage could not produce its output. The pipeline runner absorbs it into the
 * job record; it never reaches an API caller directly.
 */
public class StageExecutionException extends Exception {
    @Serial
    private static final long serialVersionUID = 6021399840730417832L;

    public StageExecutionException(String message) {
        super(message);
    }

    public StageExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
