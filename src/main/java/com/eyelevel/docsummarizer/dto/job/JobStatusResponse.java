package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.JobError;
import com.eyelevel.docsummarizer.model.JobResult;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Client view of one job. {@code stages} appears once the job has started, {@code result} only when
 * it COMPLETED and {@code error} only when it FAILED.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String jobId,
        JobStatus status,
        String message,
        int progress,
        String documentName,
        Integer totalPages,
        JobOptionsView options,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt,
        Double processingTimeSeconds,
        List<StageCheckpointView> stages,
        JobResult result,
        JobError error
) {
}
