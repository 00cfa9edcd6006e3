package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.JobStatus;

import java.time.Instant;

/**
 * Compact listing entry for a job.
 */
public record JobSummaryResponse(String jobId, JobStatus status, int progress, String message, String documentName,
                                 Instant createdAt, Instant updatedAt) {
}
