package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.exception.job.JobAlreadyRunningException;
import com.eyelevel.docsummarizer.exception.job.JobNotFoundException;
import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobError;
import com.eyelevel.docsummarizer.model.JobResult;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.eyelevel.docsummarizer.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies every job state change through the {@link JobStore}, one atomic update per change.
 * <p>
 * Progress writes made on behalf of a worker return {@code false} instead of throwing once the job has
 * been finalized elsewhere (typically cancelled), which tells the worker to stop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleManager {

    private final JobStore jobStore;
    private final Clock clock;

    /**
     * Moves a PENDING job to RUNNING and fixes its planned stages.
     *
     * @throws JobAlreadyRunningException if the job is already RUNNING.
     * @throws JobStateConflictException  if the job is terminal.
     */
    public Job startRun(final String jobId, final List<String> plannedStages) {
        final Job running = jobStore.update(jobId, job -> {
            if (job.getStatus() == JobStatus.RUNNING) {
                throw new JobAlreadyRunningException(jobId);
            }
            return job.startRun(plannedStages, clock.instant());
        });
        log.info("[JobId: {}] Job started with stages {}.", jobId, plannedStages);
        return running;
    }

    public boolean recordStageStarted(final String jobId, final String stageName, final String activity) {
        return tryProgressWrite(jobId, stageName,
                                () -> jobStore.update(jobId, job -> job.withStageStarted(stageName, activity,
                                                                                          clock.instant())));
    }

    public boolean recordStageCompleted(final String jobId, final String stageName, final Object output) {
        return tryProgressWrite(jobId, stageName,
                                () -> jobStore.update(jobId, job -> job.withStageCompleted(stageName, output,
                                                                                            clock.instant())));
    }

    /**
     * Marks a RUNNING job COMPLETED. A job that was finalized in the meantime is left untouched.
     */
    public Optional<Job> complete(final String jobId, final JobResult result) {
        return tryTerminalWrite(jobId, () -> jobStore.update(jobId, job -> job.complete(result, clock.instant())),
                                JobStatus.COMPLETED);
    }

    /**
     * Marks a job FAILED with the failing stage and message. A job that was finalized in the meantime
     * is left untouched.
     */
    public Optional<Job> fail(final String jobId, final JobError error) {
        return tryTerminalWrite(jobId, () -> jobStore.update(jobId, job -> job.fail(error, clock.instant())),
                                JobStatus.FAILED);
    }

    /**
     * Cancels a PENDING or RUNNING job.
     *
     * @throws JobNotFoundException      if the job does not exist.
     * @throws JobStateConflictException if the job is already terminal.
     */
    public Job cancel(final String jobId) {
        final Job cancelled = jobStore.update(jobId, job -> job.cancel(clock.instant()));
        log.info("[JobId: {}] Job cancelled.", jobId);
        return cancelled;
    }

    private boolean tryProgressWrite(final String jobId, final String stageName, final Runnable write) {
        try {
            write.run();
            return true;
        } catch (JobStateConflictException | JobNotFoundException e) {
            log.info("[JobId: {}] Progress for stage '{}' not recorded: {}", jobId, stageName, e.getMessage());
            return false;
        }
    }

    private Optional<Job> tryTerminalWrite(final String jobId, final Supplier<Job> write,
                                           final JobStatus target) {
        try {
            final Job job = write.get();
            if (target == JobStatus.FAILED) {
                log.error("[JobId: {}] Job failed at stage '{}': {}", jobId, job.getError().stage(),
                          job.getError().message());
            } else {
                log.info("[JobId: {}] Job {} in {} ms.", jobId, target,
                         job.processingTime().map(Duration::toMillis).orElse(0L));
            }
            return Optional.of(job);
        } catch (JobStateConflictException | JobNotFoundException e) {
            log.warn("[JobId: {}] Could not mark job {}: {}", jobId, target, e.getMessage());
            return Optional.empty();
        }
    }
}
