package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.dto.job.JobStatisticsResponse;
import com.eyelevel.docsummarizer.dto.job.JobStatusResponse;
import com.eyelevel.docsummarizer.dto.job.JobSummaryResponse;
import com.eyelevel.docsummarizer.exception.job.JobAlreadyRunningException;
import com.eyelevel.docsummarizer.exception.job.JobNotFoundException;
import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.eyelevel.docsummarizer.service.storage.DocumentStorageService;
import com.eyelevel.docsummarizer.store.JobStatistics;
import com.eyelevel.docsummarizer.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for every job operation exposed to clients: submission, start, status reads,
 * synchronous runs, listing, cancellation and deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOrchestrationService {

    private final JobStore jobStore;
    private final JobExecutionService jobExecutionService;
    private final JobLifecycleManager lifecycleManager;
    private final JobStatusProjector projector;
    private final DocumentStorageService documentStorageService;

    /**
     * Registers a PENDING job for a stored document.
     *
     * @return The new job id.
     */
    public String submit(final InputHandle input, final JobConfig config) {
        final Job job = jobStore.create(config, input);
        return job.getId();
    }

    /**
     * Starts the job's pipeline in the background.
     *
     * @throws JobNotFoundException       if the job does not exist.
     * @throws JobAlreadyRunningException if the job is already running.
     * @throws JobStateConflictException  if the job already finished or was cancelled.
     */
    public JobStatusResponse start(final String jobId) {
        log.info("[JobId: {}] Received request to start processing.", jobId);
        final Job job = jobStore.get(jobId);
        if (job.getStatus() == JobStatus.RUNNING) {
            throw new JobAlreadyRunningException(jobId);
        }
        if (job.getStatus().isTerminal()) {
            throw new JobStateConflictException(
                    String.format("Job '%s' is %s and cannot be started again.", jobId, job.getStatus()));
        }
        return projector.toStatus(jobExecutionService.submitAsync(jobId));
    }

    public JobStatusResponse status(final String jobId) {
        return projector.toStatus(jobStore.get(jobId));
    }

    /**
     * Creates a job and runs it to completion on the calling thread. The stored document is discarded
     * afterwards; the job record stays available for status reads.
     */
    public JobStatusResponse runSynchronously(final InputHandle input, final JobConfig config) {
        try {
            return projector.toStatus(jobExecutionService.runSync(config, input));
        } finally {
            documentStorageService.discard(input);
        }
    }

    public List<JobSummaryResponse> listJobs() {
        return jobStore.list().stream().map(projector::toSummary).toList();
    }

    /**
     * Cancels a PENDING or RUNNING job. A running pipeline stops at its next stage boundary.
     *
     * @throws JobNotFoundException      if the job does not exist.
     * @throws JobStateConflictException if the job already reached a terminal status.
     */
    public JobStatusResponse cancelJob(final String jobId) {
        final Job cancelled = lifecycleManager.cancel(jobId);
        jobExecutionService.requestCancellation(jobId);
        return projector.toStatus(cancelled);
    }

    /**
     * Removes a job and its stored document.
     *
     * @throws JobNotFoundException      if the job does not exist.
     * @throws JobStateConflictException if the job is running; cancel it first.
     */
    public void deleteJob(final String jobId) {
        final Job removed = jobStore.delete(jobId);
        documentStorageService.discard(removed.getInput());
    }

    public JobStatisticsResponse statistics() {
        final JobStatistics statistics = jobStore.statistics();
        return new JobStatisticsResponse(statistics.totalJobs(), statistics.byStatus(),
                                         jobExecutionService.activeRunCount());
    }
}
