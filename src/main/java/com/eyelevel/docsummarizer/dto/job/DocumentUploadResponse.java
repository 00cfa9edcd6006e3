package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.JobStatus;

/**
 * Returned after an upload created a PENDING job.
 */
public record DocumentUploadResponse(String jobId, JobStatus status, String documentName, long sizeBytes,
                                     Integer totalPages, JobOptionsView options) {
}
