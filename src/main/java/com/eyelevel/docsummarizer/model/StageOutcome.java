package com.eyelevel.docsummarizer.model;

/**
 * How a single pipeline stage ended.
 */
public enum StageOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
