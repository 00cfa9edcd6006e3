package com.eyelevel.docsummarizer.model;

/**
 * Terminal failure detail of a job.
 *
 * @param stage   Name of the stage that failed.
 * @param message The failure message reported by the stage.
 */
public record JobError(String stage, String message) {
}
