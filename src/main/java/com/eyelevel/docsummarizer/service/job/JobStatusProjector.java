package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.dto.job.JobOptionsView;
import com.eyelevel.docsummarizer.dto.job.JobStatusResponse;
import com.eyelevel.docsummarizer.dto.job.JobSummaryResponse;
import com.eyelevel.docsummarizer.dto.job.StageCheckpointView;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Renders job snapshots into client responses. Pure: it reads only the snapshot it is given.
 */
@Component
public class JobStatusProjector {

    public JobStatusResponse toStatus(final Job job) {
        final JobConfig config = job.getConfig();
        final Optional<InputHandle> input = Optional.ofNullable(job.getInput());
        return JobStatusResponse.builder()
                                .jobId(job.getId())
                                .status(job.getStatus())
                                .message(job.getMessage())
                                .progress(job.progressPercent())
                                .documentName(input.map(InputHandle::getOriginalFilename).orElse(null))
                                .totalPages(input.map(InputHandle::getPageCount).orElse(null))
                                .options(toOptions(config))
                                .createdAt(job.getCreatedAt())
                                .updatedAt(job.getUpdatedAt())
                                .startedAt(job.getStartedAt())
                                .finishedAt(job.getFinishedAt())
                                .processingTimeSeconds(job.processingTime()
                                                          .map(duration -> duration.toMillis() / 1000.0)
                                                          .orElse(null))
                                .stages(job.getStatus() == JobStatus.PENDING ? null : job.getProgress().stream()
                                        .map(checkpoint -> new StageCheckpointView(checkpoint.getStageName(),
                                                checkpoint.getStartedAt(), checkpoint.getFinishedAt(),
                                                checkpoint.getOutcome()))
                                        .toList())
                                .result(job.getStatus() == JobStatus.COMPLETED ? job.getResult() : null)
                                .error(job.getStatus() == JobStatus.FAILED ? job.getError() : null)
                                .build();
    }

    public JobOptionsView toOptions(final JobConfig config) {
        return new JobOptionsView(config.getSummaryMode(), config.getLlmBackend(), config.isExtractEntities(),
                                  config.isExtractTables(), config.getEntityTypes(), config.getMaxPages());
    }

    public JobSummaryResponse toSummary(final Job job) {
        return new JobSummaryResponse(job.getId(), job.getStatus(), job.progressPercent(), job.getMessage(),
                                      job.getInput() != null ? job.getInput().getOriginalFilename() : null,
                                      job.getCreatedAt(), job.getUpdatedAt());
    }
}
